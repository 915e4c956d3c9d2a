package com.flamingo.pagination.domain.layout;

/** Page margins in the measurement port's unit. */
public record Margins(double top, double right, double bottom, double left) {

  public static Margins uniform(double value) {
    return new Margins(value, value, value, value);
  }
}
