package com.flamingo.pagination.domain.measure;

/**
 * Layout metrics computed for one block by the measurement port. Immutable once produced.
 */
public interface Measure {

  /** Total vertical extent of the measured block. */
  double totalHeight();

  /** Whether every height in this measure is finite and non-negative. */
  default boolean hasUsableHeights() {
    return isUsableHeight(totalHeight());
  }

  static boolean isUsableHeight(double height) {
    return Double.isFinite(height) && height >= 0;
  }
}
