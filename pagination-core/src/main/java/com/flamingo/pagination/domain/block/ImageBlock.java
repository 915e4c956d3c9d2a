package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.enums.BlockKind;

/**
 * An inline or block-level image.
 *
 * @param id stable block id
 * @param src image source reference
 * @param attrs positions and opaque image attributes
 */
public record ImageBlock(String id, String src, BlockAttrs attrs) implements FlowBlock {

  public ImageBlock {
    attrs = attrs == null ? BlockAttrs.EMPTY : attrs;
  }

  @Override
  public BlockKind kind() {
    return BlockKind.IMAGE;
  }

  @Override
  public PositionSpan positionSpan() {
    return attrs.span();
  }

  @Override
  public ImageBlock shiftPositions(int delta) {
    return new ImageBlock(id, src, attrs.shift(delta));
  }
}
