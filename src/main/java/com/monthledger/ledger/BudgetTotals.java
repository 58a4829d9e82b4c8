package com.monthledger.ledger;

import com.monthledger.model.BudgetData;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.PersonBudget;
import com.monthledger.model.PersonSlot;
import java.math.BigDecimal;
import java.util.List;

public record BudgetTotals(PersonTotals person1, PersonTotals person2, BigDecimal jointBalance) {

  public static BudgetTotals of(BudgetData data) {
    return new BudgetTotals(
        PersonTotals.of(data.person(PersonSlot.PERSON1)),
        PersonTotals.of(data.person(PersonSlot.PERSON2)),
        data.getJointAccount().closingBalance());
  }

  public record PersonTotals(BigDecimal income, BigDecimal fixed, BigDecimal categories, BigDecimal available) {
    static PersonTotals of(PersonBudget person) {
      BigDecimal income = sum(person.lines(LineKind.INCOME));
      BigDecimal fixed = sum(person.lines(LineKind.FIXED_EXPENSE));
      BigDecimal categories = sum(person.lines(LineKind.CATEGORY));
      return new PersonTotals(income, fixed, categories, income.subtract(fixed).subtract(categories));
    }

    private static BigDecimal sum(List<LineItem> lines) {
      return lines.stream()
          .map(LineItem::getAmount)
          .filter(amount -> amount != null)
          .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
  }
}
