package com.flamingo.pagination.service.footnote;

import com.flamingo.pagination.domain.enums.ConvergenceOutcome;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.ReservationVector;
import java.util.List;

/**
 * Final layout of the footnote reserve loop.
 *
 * @param layout body and footnote band fragments, laid out with {@code reserves}
 * @param reserves reservation vector the layout was produced with
 * @param passes number of pagination passes run, including any final relayout
 * @param outcome how the loop ended
 * @param unresolvedFootnoteIds footnotes that got no reservation (reference on no page, or no body)
 */
public record ReserveLoopResult(
    Layout layout,
    ReservationVector reserves,
    int passes,
    ConvergenceOutcome outcome,
    List<String> unresolvedFootnoteIds) {

  public ReserveLoopResult {
    unresolvedFootnoteIds =
        unresolvedFootnoteIds == null ? List.of() : List.copyOf(unresolvedFootnoteIds);
  }
}
