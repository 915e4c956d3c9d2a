package com.flamingo.pagination.domain.measure;

/** Size of an atomic block (image, drawing) that is never split across pages. */
public record BoxMeasure(double width, double height) implements Measure {

  @Override
  public double totalHeight() {
    return height;
  }
}
