package com.flamingo.pagination.service.cache;

import com.flamingo.pagination.domain.enums.LookupStatus;

/**
 * Result of {@link FlowBlockCache#get}.
 *
 * <p>{@code nodeJson} and {@code nodeRev} are what the caller should pass back to {@link
 * FlowBlockCache#set} for the current generation. On a trusted hit {@code nodeJson} is the stored
 * serialization, so a later verified lookup still has something to compare against without the
 * node being serialized on every pass.
 *
 * @param entry the cached entry on a hit, {@code null} on a miss
 * @param nodeJson canonical serialization of the node (stored copy on trusted hits)
 * @param nodeRev the node's revision marker, or {@code null}
 * @param status hit or miss, and which check decided it
 */
public record CacheLookup(CacheEntry entry, String nodeJson, Integer nodeRev, LookupStatus status) {

  public boolean isHit() {
    return status.isHit();
  }
}
