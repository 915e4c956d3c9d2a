package com.flamingo.pagination.service.layout;

import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.source.SourceNode;
import java.util.List;

/**
 * One top-level source node of the document and the blocks it converts to.
 *
 * @param blockId stable id of the node, used as the cache key
 * @param node the node as it is now; its revision marker and serialization decide cache reuse
 * @param pmStart current start position of the node's first block, or {@code null} if unknown
 * @param blocks freshly converted blocks, measured only when the cache misses
 */
public record SourceBlock(
    String blockId, SourceNode node, Integer pmStart, List<FlowBlock> blocks) {

  public SourceBlock {
    if (blockId == null || blockId.isBlank()) {
      throw new IllegalArgumentException("Source block id is required");
    }
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }
}
