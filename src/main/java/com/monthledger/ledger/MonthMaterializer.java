package com.monthledger.ledger;

import com.monthledger.config.LedgerProperties;
import com.monthledger.model.BudgetData;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.MonthKey;
import com.monthledger.model.PersonBudget;
import com.monthledger.model.PersonSlot;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Creates months that do not exist yet, either empty or derived from the month before.
 */
@Component
public class MonthMaterializer {
  private final RecurringWindowEvaluator windowEvaluator;
  private final LedgerProperties ledgerProperties;

  public MonthMaterializer(RecurringWindowEvaluator windowEvaluator, LedgerProperties ledgerProperties) {
    this.windowEvaluator = windowEvaluator;
    this.ledgerProperties = ledgerProperties;
  }

  public BudgetData emptyMonth() {
    BudgetData data = new BudgetData();
    data.setPerson1(new PersonBudget(ledgerProperties.person1Name()));
    data.setPerson2(new PersonBudget(ledgerProperties.person2Name()));
    return data;
  }

  /**
   * Derives {@code targetKey} from {@code previous}. Lines opted out of propagation are not
   * carried, recurring categories only when their window covers the target month, and the joint
   * account starts without transactions (its opening balance comes from carryover).
   */
  public BudgetData deriveFrom(BudgetData previous, String targetKey) {
    if (previous == null) {
      return emptyMonth();
    }
    BudgetData next = new BudgetData();
    for (PersonSlot slot : PersonSlot.values()) {
      PersonBudget source = previous.person(slot);
      PersonBudget target = next.person(slot);
      target.setName(source.getName());
      for (LineKind kind : LineKind.values()) {
        target.lines(kind).addAll(carryLines(source.lines(kind), targetKey));
      }
      next.linkUser(slot, previous.userId(slot));
    }
    next.getJointAccount().setInitialBalance(previous.getJointAccount().closingBalance());
    return next;
  }

  /**
   * Ensures {@code count} consecutive months exist from {@code seedKey} on, deriving each missing
   * month from its predecessor.
   *
   * @return keys that were created
   */
  public List<String> materialize(NavigableMap<String, BudgetData> months, String seedKey, int count) {
    List<String> created = new ArrayList<>();
    if (!months.containsKey(seedKey)) {
      Map.Entry<String, BudgetData> before = months.lowerEntry(seedKey);
      months.put(seedKey, before == null ? emptyMonth() : deriveFrom(before.getValue(), seedKey));
      created.add(seedKey);
    }
    String previousKey = seedKey;
    for (int i = 1; i < count; i++) {
      String key = MonthKey.plusMonths(seedKey, i);
      if (!months.containsKey(key)) {
        months.put(key, deriveFrom(months.get(previousKey), key));
        created.add(key);
      }
      previousKey = key;
    }
    return created;
  }

  private List<LineItem> carryLines(List<LineItem> lines, String targetKey) {
    List<LineItem> carried = new ArrayList<>();
    for (LineItem line : lines) {
      if (!line.isPropagate() || !windowEvaluator.isActiveIn(line, targetKey)) {
        continue;
      }
      LineItem copy = line.copy();
      copy.setId(UUID.randomUUID().toString());
      copy.setChecked(false);
      carried.add(copy);
    }
    return carried;
  }
}
