package com.flamingo.pagination.domain.layout;

import java.util.List;
import java.util.Optional;

/**
 * Paginated output handed to renderers. Fragment geometry and page reservations are final.
 *
 * @param pages pages in order
 */
public record Layout(List<Page> pages) {

  public Layout {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public int pageCount() {
    return pages.size();
  }

  public Page page(int index) {
    return pages.get(index);
  }

  /** The page holding a fragment of {@code blockId}, if any. */
  public Optional<Page> pageOf(String blockId) {
    return pages.stream().filter(p -> p.hasFragment(blockId)).findFirst();
  }

  /** The current reservation of every page, indexed by page. */
  public ReservationVector reserves() {
    double[] values = new double[pages.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = pages.get(i).footnoteReserved();
    }
    return ReservationVector.of(values);
  }
}
