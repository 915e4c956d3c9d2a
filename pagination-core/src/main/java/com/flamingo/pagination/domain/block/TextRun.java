package com.flamingo.pagination.domain.block;

/**
 * A run of uniformly formatted text inside a {@link ParagraphBlock}.
 *
 * @param text run text
 * @param fontFamily resolved font family
 * @param fontSize font size in layout units
 * @param pmStart source position of the first character, or {@code null}
 * @param pmEnd source position after the last character, or {@code null}
 */
public record TextRun(
    String text, String fontFamily, double fontSize, Integer pmStart, Integer pmEnd) {

  public TextRun {
    text = text == null ? "" : text;
  }

  public static TextRun of(String text, String fontFamily, double fontSize, int pmStart) {
    String value = text == null ? "" : text;
    return new TextRun(value, fontFamily, fontSize, pmStart, pmStart + value.length());
  }

  public TextRun shift(int delta) {
    return new TextRun(
        text,
        fontFamily,
        fontSize,
        pmStart == null ? null : pmStart + delta,
        pmEnd == null ? null : pmEnd + delta);
  }

  public PositionSpan span() {
    return new PositionSpan(pmStart, pmEnd);
  }

  /** Source position of the character at {@code offset}, or {@code null} without a start. */
  public Integer positionAt(int offset) {
    if (pmStart == null) {
      return null;
    }
    return pmStart + Math.max(0, Math.min(offset, text.length()));
  }
}
