package io.lrma.longsplit.domain.split;

/** Delimiter matching policies. */
public enum SplitMode {
  /** Boundary-only matching of short delimiter windows, tolerant of interior content. */
  SIMPLE,
  /** Full per-element template matching with fuzzy tolerance and scoring. */
  BOUNDED_REGION
}
