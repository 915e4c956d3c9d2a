package com.flamingo.pagination.domain.enums;

/** How the footnote reserve loop ended. */
public enum ConvergenceOutcome {
  /** No footnote references were supplied; a single pass was run. */
  NO_FOOTNOTES,
  /** A pass proposed exactly the reservation it was laid out with. */
  CONVERGED,
  /** Proposals revisited an earlier reservation; resolved by the cycle fallback. */
  OSCILLATION,
  /** The pass budget ran out; the last proposal was used for a final relayout. */
  BUDGET_EXHAUSTED
}
