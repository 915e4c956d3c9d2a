package com.flamingo.pagination.domain.layout;

/**
 * Size and margins shared by a run of pages.
 *
 * @param size page size
 * @param margins page margins
 */
public record PageGeometry(PageSize size, Margins margins) {

  public PageGeometry {
    if (size == null || margins == null) {
      throw new IllegalArgumentException("Page size and margins are required");
    }
    if (size.width() <= 0 || size.height() <= 0) {
      throw new IllegalArgumentException("Page size must be positive: " + size);
    }
    if (margins.top() < 0 || margins.right() < 0 || margins.bottom() < 0 || margins.left() < 0) {
      throw new IllegalArgumentException("Margins must not be negative: " + margins);
    }
  }

  /** Height available to body content when nothing is reserved for footnotes. */
  public double contentHeight() {
    return size.height() - margins.top() - margins.bottom();
  }

  public double contentWidth() {
    return size.width() - margins.left() - margins.right();
  }
}
