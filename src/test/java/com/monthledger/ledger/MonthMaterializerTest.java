package com.monthledger.ledger;

import static com.monthledger.ledger.LedgerFixtures.categories;
import static com.monthledger.ledger.LedgerFixtures.fixed;
import static org.assertj.core.api.Assertions.assertThat;

import com.monthledger.model.BudgetData;
import com.monthledger.model.LineItem;
import com.monthledger.model.PersonSlot;
import com.monthledger.model.TransactionType;
import java.math.BigDecimal;
import java.util.List;
import java.util.NavigableMap;
import org.junit.jupiter.api.Test;

class MonthMaterializerTest {
  private final MonthMaterializer materializer = LedgerFixtures.materializer();

  @Test
  void derivesNextMonthFromPrevious() {
    BudgetData january = materializer.emptyMonth();
    january.getPerson1().setName("Alice");
    january.linkUser(PersonSlot.PERSON1, "user-1");
    LineItem rent = LedgerFixtures.line("Rent", "800");
    rent.setChecked(true);
    fixed(january).add(rent);
    LineItem pinned = LedgerFixtures.line("One-off", "40");
    pinned.setPropagate(false);
    fixed(january).add(pinned);
    categories(january).add(LedgerFixtures.recurring("Gym", "30", "2024-01", 1));
    categories(january).add(LedgerFixtures.line("Food", "300"));
    january.getJointAccount().setInitialBalance(new BigDecimal("100"));
    january.getJointAccount().getTransactions().add(LedgerFixtures.transaction(TransactionType.DEPOSIT, "20"));

    BudgetData february = materializer.deriveFrom(january, "2024-02");

    assertThat(february.getPerson1().getName()).isEqualTo("Alice");
    assertThat(february.getPerson1UserId()).isEqualTo("user-1");
    assertThat(fixed(february)).extracting(LineItem::getName).containsExactly("Rent");
    assertThat(fixed(february).get(0).isChecked()).isFalse();
    assertThat(fixed(february).get(0).getId()).isNotEqualTo(rent.getId());
    assertThat(categories(february)).extracting(LineItem::getName).containsExactly("Food");
    assertThat(february.getJointAccount().getTransactions()).isEmpty();
    assertThat(february.getJointAccount().getInitialBalance()).isEqualByComparingTo("120");
  }

  @Test
  void materializeFillsOnlyMissingMonths() {
    NavigableMap<String, BudgetData> months = LedgerFixtures.emptyMonths("2024-11", "2025-01");
    fixed(months.get("2024-11")).add(LedgerFixtures.line("Rent", "800"));

    List<String> created = materializer.materialize(months, "2024-11", 4);

    assertThat(created).containsExactly("2024-12", "2025-02");
    assertThat(fixed(months.get("2024-12"))).extracting(LineItem::getName).containsExactly("Rent");
    assertThat(fixed(months.get("2025-01"))).isEmpty();
    assertThat(fixed(months.get("2025-02"))).isEmpty();
  }

  @Test
  void materializeFromMissingSeedUsesEarlierMonth() {
    NavigableMap<String, BudgetData> months = LedgerFixtures.emptyMonths("2024-01");
    fixed(months.get("2024-01")).add(LedgerFixtures.line("Rent", "800"));

    List<String> created = materializer.materialize(months, "2024-05", 1);

    assertThat(created).containsExactly("2024-05");
    assertThat(fixed(months.get("2024-05"))).extracting(LineItem::getName).containsExactly("Rent");
  }
}
