package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.enums.BlockKind;

/**
 * One unit of layoutable content produced by the document-tree adapter.
 *
 * <p>Implementations are immutable records. The {@link #id()} is unique within a layout request and
 * stable across requests for unchanged content; it keys the measurement cache and links footnote
 * references to their bodies.
 */
public interface FlowBlock {

  String id();

  BlockKind kind();

  /** Overall source positions covered by this block, {@link PositionSpan#EMPTY} when unknown. */
  PositionSpan positionSpan();

  /**
   * Returns a copy of this block with every position field it carries moved by {@code delta}.
   *
   * <p>The result is always a new instance, even for {@code delta == 0} or when the block has no
   * positions; callers compare identities to detect re-used blocks.
   */
  FlowBlock shiftPositions(int delta);
}
