package com.flamingo.pagination.domain.enums;

/** Break variants carried by {@link com.flamingo.pagination.domain.block.BreakBlock}. */
public enum BreakKind {
  PAGE(BlockKind.PAGE_BREAK),
  COLUMN(BlockKind.COLUMN_BREAK),
  SECTION(BlockKind.SECTION_BREAK);

  private final BlockKind blockKind;

  BreakKind(BlockKind blockKind) {
    this.blockKind = blockKind;
  }

  public BlockKind blockKind() {
    return blockKind;
  }
}
