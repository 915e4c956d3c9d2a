package com.flamingo.pagination.service.layout;

import com.flamingo.pagination.domain.enums.ConvergenceOutcome;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.ReservationVector;
import java.util.List;

/**
 * Output of one incremental layout pass.
 *
 * @param layout final layout, footnote bands included
 * @param reserves reservation vector the layout was produced with
 * @param passes pagination passes the footnote loop ran
 * @param outcome how the footnote loop ended
 * @param unresolvedFootnoteIds footnotes left without a reservation
 * @param cacheHits source nodes reused from the cache
 * @param cacheMisses source nodes measured again
 * @param firstDirtyPageIndex first page that differs from the session's previous layout, {@code
 *     -1} if none does
 */
public record LayoutResult(
    Layout layout,
    ReservationVector reserves,
    int passes,
    ConvergenceOutcome outcome,
    List<String> unresolvedFootnoteIds,
    int cacheHits,
    int cacheMisses,
    int firstDirtyPageIndex) {

  public LayoutResult {
    unresolvedFootnoteIds =
        unresolvedFootnoteIds == null ? List.of() : List.copyOf(unresolvedFootnoteIds);
  }
}
