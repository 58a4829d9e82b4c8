package com.monthledger.service;

import java.util.SortedSet;

/**
 * Outcome of one atomic change to the month map: the action's own result and the months whose
 * stored value changed or disappeared, carryover included.
 */
public record LedgerMutation<T>(T result, SortedSet<String> changedMonths, SortedSet<String> removedMonths) {
  public boolean isEmpty() {
    return changedMonths.isEmpty() && removedMonths.isEmpty();
  }
}
