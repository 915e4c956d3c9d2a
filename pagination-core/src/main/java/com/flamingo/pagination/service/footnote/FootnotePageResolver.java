package com.flamingo.pagination.service.footnote;

import com.flamingo.pagination.domain.layout.Fragment;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.Page;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps footnote references to the page their mark landed on in a layout.
 *
 * <p>A reference belongs to the page holding the body fragment with the greatest start position not
 * after the reference, provided that fragment's span contains it. A position shared by a split
 * paragraph's two fragments therefore goes to the continuation.
 *
 * <p>References are handled in position order and a footnote referenced more than once is assigned
 * to the page of its first reference.
 */
@Component
@Slf4j
public class FootnotePageResolver {

  public FootnoteAssignment resolve(Layout layout, List<FootnoteRef> refs) {
    NavigableMap<Integer, Located> byStart = indexBodyFragments(layout);

    List<FootnoteRef> ordered = new ArrayList<>(refs);
    ordered.sort(Comparator.comparingInt(FootnoteRef::pos));

    Map<Integer, List<String>> byPage = new TreeMap<>();
    List<String> unresolved = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (FootnoteRef ref : ordered) {
      if (!seen.add(ref.id())) {
        continue;
      }
      Map.Entry<Integer, Located> floor = byStart.floorEntry(ref.pos());
      if (floor == null || !floor.getValue().fragment().containsPosition(ref.pos())) {
        unresolved.add(ref.id());
        continue;
      }
      byPage.computeIfAbsent(floor.getValue().pageIndex(), k -> new ArrayList<>()).add(ref.id());
    }
    return new FootnoteAssignment(
        Collections.unmodifiableMap(byPage), Collections.unmodifiableList(unresolved));
  }

  private NavigableMap<Integer, Located> indexBodyFragments(Layout layout) {
    NavigableMap<Integer, Located> byStart = new TreeMap<>();
    for (Page page : layout.pages()) {
      for (Fragment fragment : page.bodyFragments()) {
        if (fragment.pmStart() != null && fragment.pmEnd() != null) {
          byStart.putIfAbsent(fragment.pmStart(), new Located(page.index(), fragment));
        }
      }
    }
    return byStart;
  }

  private record Located(int pageIndex, Fragment fragment) {}
}
