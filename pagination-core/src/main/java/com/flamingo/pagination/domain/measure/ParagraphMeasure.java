package com.flamingo.pagination.domain.measure;

import java.util.List;

/**
 * Line breaks of a paragraph.
 *
 * @param lines lines in order
 * @param totalHeight sum of line heights (plus any spacing the measurer folded in)
 */
public record ParagraphMeasure(List<LineMeasure> lines, double totalHeight) implements Measure {

  public ParagraphMeasure {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  @Override
  public boolean hasUsableHeights() {
    if (!Measure.isUsableHeight(totalHeight)) {
      return false;
    }
    for (LineMeasure line : lines) {
      if (!Measure.isUsableHeight(line.lineHeight())) {
        return false;
      }
    }
    return true;
  }

  public static ParagraphMeasure of(List<LineMeasure> lines) {
    double height = 0;
    for (LineMeasure line : lines) {
      height += line.lineHeight();
    }
    return new ParagraphMeasure(lines, height);
  }
}
