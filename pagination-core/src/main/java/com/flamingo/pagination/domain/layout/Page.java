package com.flamingo.pagination.domain.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * One laid-out page.
 *
 * @param index zero-based page index
 * @param size page size
 * @param margins page margins
 * @param footnoteReserved height withheld above the bottom margin for footnote bodies
 * @param fragments body fragments followed by footnote band fragments
 */
public record Page(
    int index, PageSize size, Margins margins, double footnoteReserved, List<Fragment> fragments) {

  public Page {
    fragments = fragments == null ? List.of() : List.copyOf(fragments);
  }

  /** Top edge of the footnote band; body fragments never extend below it. */
  public double footnoteBandTop() {
    return size.height() - margins.bottom() - footnoteReserved;
  }

  public List<Fragment> bodyFragments() {
    return fragments.stream().filter(f -> !f.isFootnote()).toList();
  }

  public List<Fragment> footnoteFragments() {
    return fragments.stream().filter(Fragment::isFootnote).toList();
  }

  public boolean hasFragment(String blockId) {
    return fragments.stream().anyMatch(f -> f.blockId().equals(blockId));
  }

  public Page withAppendedFragments(List<Fragment> extra) {
    List<Fragment> all = new ArrayList<>(fragments);
    all.addAll(extra);
    return new Page(index, size, margins, footnoteReserved, all);
  }
}
