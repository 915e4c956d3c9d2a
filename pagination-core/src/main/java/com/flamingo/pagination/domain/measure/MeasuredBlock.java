package com.flamingo.pagination.domain.measure;

import com.flamingo.pagination.domain.block.FlowBlock;

/**
 * A block paired with its measure. Breaks carry a {@code null} measure.
 */
public record MeasuredBlock(FlowBlock block, Measure measure) {

  public MeasuredBlock shift(int delta) {
    return new MeasuredBlock(block.shiftPositions(delta), measure);
  }
}
