package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.measure.MeasuredBlock;
import java.util.List;

/**
 * Position-shift operations over blocks.
 *
 * <p>When an edit inserts or removes content before a cached region, cached blocks are slid by the
 * edit's size instead of being rebuilt and remeasured.
 */
public final class BlockPositions {

  private BlockPositions() {}

  /** Returns a new block with every locatable position moved by {@code delta}. */
  public static FlowBlock shiftBlockPositions(FlowBlock block, int delta) {
    return block.shiftPositions(delta);
  }

  /** Element-wise {@link #shiftBlockPositions}; the returned list is always a new list. */
  public static List<FlowBlock> shiftCachedBlocks(List<FlowBlock> blocks, int delta) {
    return blocks.stream().map(block -> shiftBlockPositions(block, delta)).toList();
  }

  /** Shifts measured blocks, keeping each measure. */
  public static List<MeasuredBlock> shiftMeasuredBlocks(List<MeasuredBlock> blocks, int delta) {
    return blocks.stream().map(block -> block.shift(delta)).toList();
  }

  /**
   * First known start position among {@code blocks}, or {@code null}. Used to work out how far a
   * cached region moved.
   */
  public static Integer firstStart(List<? extends FlowBlock> blocks) {
    for (FlowBlock block : blocks) {
      Integer start = block.positionSpan().pmStart();
      if (start != null) {
        return start;
      }
    }
    return null;
  }
}
