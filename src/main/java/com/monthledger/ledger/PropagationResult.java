package com.monthledger.ledger;

import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of one ledger edit: the line that was edited, the months whose content changed, and the
 * later months left alone because their copy had diverged.
 */
public record PropagationResult(
    String lineId,
    String templateId,
    SortedSet<String> touchedMonths,
    List<String> skippedDivergentMonths
) {
  public String earliestTouched() {
    return touchedMonths.isEmpty() ? null : touchedMonths.first();
  }
}
