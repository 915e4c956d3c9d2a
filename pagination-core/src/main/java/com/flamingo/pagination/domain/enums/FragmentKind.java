package com.flamingo.pagination.domain.enums;

/** What a placed {@link com.flamingo.pagination.domain.layout.Fragment} draws. */
public enum FragmentKind {
  PARAGRAPH,
  IMAGE,
  DRAWING,
  /** The divider line drawn above a page's footnote bodies. */
  SEPARATOR;

  public static FragmentKind forBlock(BlockKind kind) {
    return switch (kind) {
      case PARAGRAPH -> PARAGRAPH;
      case IMAGE -> IMAGE;
      case DRAWING -> DRAWING;
      default ->
          throw new IllegalArgumentException("Breaks are never placed as fragments: " + kind);
    };
  }
}
