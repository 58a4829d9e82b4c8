package com.monthledger.ledger;

import com.monthledger.model.BudgetData;
import com.monthledger.model.JointAccount;
import java.math.BigDecimal;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Keeps each month's joint opening balance equal to the previous month's closing balance.
 */
@Component
public class JointBalanceCarryover {

  /**
   * Folds forward from {@code startKey}: every later month's initial balance becomes the closing
   * balance of the month before it. Months up to and including {@code startKey} are not modified.
   *
   * @return keys of the months whose initial balance actually changed
   */
  public SortedSet<String> recarryFrom(NavigableMap<String, BudgetData> months, String startKey) {
    SortedSet<String> changed = new TreeSet<>();
    if (startKey == null || !months.containsKey(startKey)) {
      return changed;
    }
    BigDecimal running = balanceOf(months.get(startKey));
    for (Map.Entry<String, BudgetData> entry : months.tailMap(startKey, false).entrySet()) {
      BudgetData month = entry.getValue();
      if (month == null) {
        continue;
      }
      JointAccount account = month.getJointAccount();
      if (account == null) {
        account = new JointAccount();
        month.setJointAccount(account);
      }
      BigDecimal carried = Amounts.canonical(running);
      if (account.getInitialBalance() == null || account.getInitialBalance().compareTo(carried) != 0) {
        changed.add(entry.getKey());
      }
      account.setInitialBalance(carried);
      running = account.closingBalance();
    }
    return changed;
  }

  public BigDecimal balanceOf(BudgetData month) {
    if (month == null || month.getJointAccount() == null) {
      return BigDecimal.ZERO;
    }
    return month.getJointAccount().closingBalance();
  }
}
