package com.flamingo.pagination.service.cache;

import com.flamingo.pagination.domain.measure.MeasuredBlock;
import java.util.List;

/**
 * Last known measured result for one source node.
 *
 * @param blockId id of the source node's block group
 * @param serializedSource canonical serialization of the source node, used only for verified
 *     lookups
 * @param revisionMarker the node's revision marker when stored, or {@code null}
 * @param blocks measured blocks converted from the node
 * @param orderIndex position of the node in the document when stored
 */
public record CacheEntry(
    String blockId,
    String serializedSource,
    Integer revisionMarker,
    List<MeasuredBlock> blocks,
    int orderIndex) {

  public CacheEntry {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }
}
