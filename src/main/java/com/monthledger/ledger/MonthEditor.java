package com.monthledger.ledger;

import com.monthledger.model.BudgetData;
import com.monthledger.model.JointTransaction;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.PersonSlot;
import com.monthledger.model.TransactionType;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Edits that stay inside a single month: display order, person identity and the joint account.
 * Balance-affecting edits still require a carryover from the edited month.
 */
@Component
public class MonthEditor {
  private final Clock clock;

  public MonthEditor(Clock clock) {
    this.clock = clock;
  }

  public boolean reorderLine(BudgetData month, PersonSlot slot, LineKind kind, String lineId, MoveDirection direction) {
    List<LineItem> lines = month.person(slot).lines(kind);
    return swap(lines, indexOf(lines, line -> line.getId().equals(lineId), "Line not found: " + lineId), direction);
  }

  public void renamePerson(BudgetData month, PersonSlot slot, String name) {
    month.person(slot).setName(name == null ? "" : name.trim());
  }

  public void linkUser(BudgetData month, PersonSlot slot, String userId) {
    month.linkUser(slot, userId == null || userId.isBlank() ? null : userId);
  }

  public void setInitialBalance(BudgetData month, BigDecimal initialBalance) {
    month.getJointAccount().setInitialBalance(Amounts.canonical(initialBalance));
  }

  public JointTransaction addTransaction(BudgetData month, TransactionType type, TransactionPatch values) {
    JointTransaction transaction = new JointTransaction(
        UUID.randomUUID().toString(),
        LocalDate.now(clock).toString(),
        "",
        BigDecimal.ZERO,
        type == null ? TransactionType.EXPENSE : type,
        month.getPerson1().getName()
    );
    if (values != null) {
      values.applyTo(transaction);
    }
    month.getJointAccount().getTransactions().add(transaction);
    return transaction;
  }

  public JointTransaction updateTransaction(BudgetData month, String transactionId, TransactionPatch patch) {
    JointTransaction transaction = requireTransaction(month, transactionId);
    patch.applyTo(transaction);
    return transaction;
  }

  public void deleteTransaction(BudgetData month, String transactionId) {
    month.getJointAccount().getTransactions().remove(requireTransaction(month, transactionId));
  }

  public boolean reorderTransaction(BudgetData month, String transactionId, MoveDirection direction) {
    List<JointTransaction> transactions = month.getJointAccount().getTransactions();
    int index = indexOf(transactions, tx -> tx.getId().equals(transactionId), "Transaction not found: " + transactionId);
    return swap(transactions, index, direction);
  }

  private JointTransaction requireTransaction(BudgetData month, String transactionId) {
    return month.getJointAccount().getTransactions().stream()
        .filter(tx -> tx.getId().equals(transactionId))
        .findFirst()
        .orElseThrow(() -> new EntryNotFoundException("Transaction not found: " + transactionId));
  }

  private static <T> int indexOf(List<T> items, Predicate<T> predicate, String missingMessage) {
    for (int i = 0; i < items.size(); i++) {
      if (predicate.test(items.get(i))) {
        return i;
      }
    }
    throw new EntryNotFoundException(missingMessage);
  }

  private static <T> boolean swap(List<T> items, int index, MoveDirection direction) {
    int target = direction == MoveDirection.UP ? index - 1 : index + 1;
    if (target < 0 || target >= items.size()) {
      return false;
    }
    Collections.swap(items, index, target);
    return true;
  }
}
