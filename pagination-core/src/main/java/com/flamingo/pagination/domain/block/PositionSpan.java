package com.flamingo.pagination.domain.block;

/**
 * Optional pair of source document positions covered by a block, run or attribute set.
 *
 * <p>Either end may be {@code null}. Shifting never manufactures a position that was absent.
 *
 * @param pmStart first position covered (inclusive), or {@code null} when unknown
 * @param pmEnd last position covered (exclusive of the following node), or {@code null}
 */
public record PositionSpan(Integer pmStart, Integer pmEnd) {

  public static final PositionSpan EMPTY = new PositionSpan(null, null);

  public static PositionSpan of(int pmStart, int pmEnd) {
    return new PositionSpan(pmStart, pmEnd);
  }

  public boolean isEmpty() {
    return pmStart == null && pmEnd == null;
  }

  public PositionSpan shift(int delta) {
    return new PositionSpan(
        pmStart == null ? null : pmStart + delta, pmEnd == null ? null : pmEnd + delta);
  }

  /** Inclusive containment test; false when either end is unknown. */
  public boolean contains(int pos) {
    return pmStart != null && pmEnd != null && pmStart <= pos && pos <= pmEnd;
  }

  /** Smallest span covering both; unknown ends are ignored. */
  public PositionSpan union(PositionSpan other) {
    return new PositionSpan(minOf(pmStart, other.pmStart), maxOf(pmEnd, other.pmEnd));
  }

  private static Integer minOf(Integer a, Integer b) {
    if (a == null) {
      return b;
    }
    return b == null ? a : Math.min(a, b);
  }

  private static Integer maxOf(Integer a, Integer b) {
    if (a == null) {
      return b;
    }
    return b == null ? a : Math.max(a, b);
  }
}
