package com.monthledger.sync;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Summary of one flush run. {@code followUpMonths} are months whose carried balance changed after
 * a remote value was adopted and that must be written in turn.
 */
public record FlushReport(
    boolean skipped,
    List<String> pushed,
    List<String> adopted,
    List<String> dropped,
    List<String> retained,
    SortedSet<String> followUpMonths,
    boolean settingsPushed,
    boolean aborted,
    boolean connectivityLost
) {
  public static FlushReport skippedRun() {
    return new FlushReport(true, List.of(), List.of(), List.of(), List.of(),
        new TreeSet<>(), false, false, false);
  }
}
