package com.monthledger.ledger;

import com.monthledger.model.LineItem;
import com.monthledger.model.MonthKey;
import org.springframework.stereotype.Component;

/**
 * Answers whether a line is active in a month. Non-recurring lines always are; their presence
 * in a month is decided by the month's own records. A recurring line is active in the half-open
 * window {@code [startMonth, startMonth + recurringMonths)}.
 */
@Component
public class RecurringWindowEvaluator {

  public boolean isActiveIn(LineItem item, String monthKey) {
    if (item == null) {
      return false;
    }
    if (!item.isRecurring()) {
      return true;
    }
    Integer length = item.getRecurringMonths();
    String start = item.getStartMonth();
    if (length == null || start == null || !MonthKey.isValid(start) || !MonthKey.isValid(monthKey)) {
      return false;
    }
    long monthsDiff = MonthKey.monthsBetween(start, monthKey);
    return monthsDiff >= 0 && monthsDiff < length;
  }
}
