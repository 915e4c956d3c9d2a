package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.enums.BlockKind;

/**
 * A vector shape, shape group or similar drawing.
 *
 * @param id stable block id
 * @param drawingKind adapter-specific drawing type (e.g. {@code vectorShape})
 * @param attrs positions and opaque drawing attributes
 */
public record DrawingBlock(String id, String drawingKind, BlockAttrs attrs) implements FlowBlock {

  public DrawingBlock {
    attrs = attrs == null ? BlockAttrs.EMPTY : attrs;
  }

  @Override
  public BlockKind kind() {
    return BlockKind.DRAWING;
  }

  @Override
  public PositionSpan positionSpan() {
    return attrs.span();
  }

  @Override
  public DrawingBlock shiftPositions(int delta) {
    return new DrawingBlock(id, drawingKind, attrs.shift(delta));
  }
}
