package com.monthledger.model;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Helpers for {@code YYYY-MM} month keys. Lexical order of valid keys equals chronological order,
 * which every multi-month algorithm in the ledger relies on.
 */
public final class MonthKey {
  private static final Pattern FORMAT = Pattern.compile("^\\d{4}-\\d{2}$");

  private MonthKey() {
  }

  public static boolean isValid(String value) {
    if (value == null || !FORMAT.matcher(value).matches()) {
      return false;
    }
    int month = Integer.parseInt(value.substring(5, 7));
    return month >= 1 && month <= 12;
  }

  public static YearMonth parse(String value) {
    if (!isValid(value)) {
      throw new IllegalArgumentException("Invalid month key: " + value);
    }
    try {
      return YearMonth.parse(value);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("Invalid month key: " + value, ex);
    }
  }

  public static String of(YearMonth month) {
    return String.format("%04d-%02d", month.getYear(), month.getMonthValue());
  }

  public static String current(Clock clock) {
    return of(YearMonth.now(clock));
  }

  public static String plusMonths(String monthKey, long months) {
    return of(parse(monthKey).plusMonths(months));
  }

  /**
   * Signed number of months from {@code from} to {@code to}; {@code 0} when equal.
   */
  public static long monthsBetween(String from, String to) {
    return ChronoUnit.MONTHS.between(parse(from), parse(to));
  }
}
