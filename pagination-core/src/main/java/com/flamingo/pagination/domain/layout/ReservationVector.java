package com.flamingo.pagination.domain.layout;

import java.util.Arrays;

/**
 * Footnote reservation per page index. Pages past the end reserve nothing.
 *
 * <p>Trailing zeros are dropped so {@code [66]} and {@code [66, 0]} are the same vector; equality
 * is exact, which is sound because every entry is a sum of the same measured heights in the same
 * order.
 */
public final class ReservationVector {

  public static final ReservationVector ZERO = new ReservationVector(new double[0]);

  private final double[] values;

  private ReservationVector(double[] values) {
    this.values = values;
  }

  public static ReservationVector of(double... values) {
    int length = values.length;
    while (length > 0 && values[length - 1] == 0.0) {
      length--;
    }
    double[] copy = new double[length];
    for (int i = 0; i < length; i++) {
      if (values[i] < 0 || Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
        throw new IllegalArgumentException("Invalid reservation at page " + i + ": " + values[i]);
      }
      // normalise -0.0
      copy[i] = values[i] + 0.0;
    }
    return length == 0 ? ZERO : new ReservationVector(copy);
  }

  /** Reservation for {@code pageIndex}; zero past the end. */
  public double get(int pageIndex) {
    return pageIndex >= 0 && pageIndex < values.length ? values[pageIndex] : 0.0;
  }

  /** Number of pages up to and including the last non-zero reservation. */
  public int length() {
    return values.length;
  }

  public boolean isZero() {
    return values.length == 0;
  }

  public double total() {
    double sum = 0;
    for (double value : values) {
      sum += value;
    }
    return sum;
  }

  /** Element-wise maximum. */
  public ReservationVector max(ReservationVector other) {
    double[] merged = new double[Math.max(values.length, other.values.length)];
    for (int i = 0; i < merged.length; i++) {
      merged[i] = Math.max(get(i), other.get(i));
    }
    return of(merged);
  }

  /** Whether every page reserves at least what {@code other} reserves for it. */
  public boolean covers(ReservationVector other) {
    for (int i = 0; i < other.values.length; i++) {
      if (get(i) < other.values[i]) {
        return false;
      }
    }
    return true;
  }

  public double[] toArray() {
    return values.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ReservationVector other && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
