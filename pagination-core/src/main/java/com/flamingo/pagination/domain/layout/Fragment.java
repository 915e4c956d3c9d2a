package com.flamingo.pagination.domain.layout;

import com.flamingo.pagination.domain.enums.FragmentKind;

/**
 * The placed occurrence of a block, or of a line range of a paragraph, on one page.
 *
 * <p>Fragments of the footnote band are recognised by the {@link #FOOTNOTE_ID_PREFIX} on their
 * block id; no side table is kept.
 *
 * @param blockId id of the placed block
 * @param kind what the fragment draws
 * @param x left edge
 * @param y top edge
 * @param width placed width
 * @param height placed height
 * @param fromLine first paragraph line placed (0 for atomic blocks)
 * @param toLine line after the last one placed (0 for atomic blocks)
 * @param pmStart source position where the placed content starts, or {@code null}
 * @param pmEnd source position where the placed content ends, or {@code null}
 * @param continuesFromPrevPage the block started on an earlier page
 * @param continuesOnNextPage the block carries on onto a later page
 */
public record Fragment(
    String blockId,
    FragmentKind kind,
    double x,
    double y,
    double width,
    double height,
    int fromLine,
    int toLine,
    Integer pmStart,
    Integer pmEnd,
    boolean continuesFromPrevPage,
    boolean continuesOnNextPage) {

  public static final String FOOTNOTE_ID_PREFIX = "footnote-";
  public static final String SEPARATOR_ID_PREFIX = FOOTNOTE_ID_PREFIX + "separator-";

  public double bottom() {
    return y + height;
  }

  public boolean isFootnote() {
    return isFootnoteId(blockId);
  }

  public static boolean isFootnoteId(String blockId) {
    return blockId != null && blockId.startsWith(FOOTNOTE_ID_PREFIX);
  }

  /** Whether {@code pos} falls inside the placed content's source span (inclusive). */
  public boolean containsPosition(int pos) {
    return pmStart != null && pmEnd != null && pmStart <= pos && pos <= pmEnd;
  }
}
