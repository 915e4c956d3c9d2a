package com.flamingo.pagination.exception;

/**
 * Thrown when a page's content area cannot hold a single line (or a single atomic image/drawing)
 * of a block. This is the only failure pagination reports for malformed geometry.
 */
public class PageGeometryTooSmallException extends RuntimeException {

  private final String blockId;
  private final double requiredHeight;
  private final double availableHeight;
  private final String userMessage;

  public PageGeometryTooSmallException(
      String blockId, double requiredHeight, double availableHeight) {
    super(
        String.format(
            "Page content height %.2f cannot hold %.2f of block %s",
            availableHeight, requiredHeight, blockId));
    this.blockId = blockId;
    this.requiredHeight = requiredHeight;
    this.availableHeight = availableHeight;
    this.userMessage = "Page is too small to paginate this document";
  }

  public String getBlockId() {
    return blockId;
  }

  public double getRequiredHeight() {
    return requiredHeight;
  }

  public double getAvailableHeight() {
    return availableHeight;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
