package com.flamingo.pagination.domain.enums;

/** Outcome of a {@link com.flamingo.pagination.service.cache.FlowBlockCache} lookup. */
public enum LookupStatus {
  /** Revision markers matched and the stored result was trusted without inspecting content. */
  HIT_TRUSTED,
  /** Canonical serializations matched. */
  HIT_VERIFIED,
  MISS;

  public boolean isHit() {
    return this != MISS;
  }
}
