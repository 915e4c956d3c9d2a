package com.flamingo.pagination.domain.enums;

/** Kinds of layoutable content a {@link com.flamingo.pagination.domain.block.FlowBlock} can be. */
public enum BlockKind {
  PARAGRAPH,
  IMAGE,
  DRAWING,
  PAGE_BREAK,
  COLUMN_BREAK,
  SECTION_BREAK;

  /** Whether blocks of this kind force a new page instead of occupying space. */
  public boolean isBreak() {
    return this == PAGE_BREAK || this == COLUMN_BREAK || this == SECTION_BREAK;
  }
}
