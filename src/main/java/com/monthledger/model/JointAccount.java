package com.monthledger.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public class JointAccount {
  private BigDecimal initialBalance = BigDecimal.ZERO;
  private List<JointTransaction> transactions = new ArrayList<>();

  public JointAccount(BigDecimal initialBalance) {
    this.initialBalance = initialBalance;
  }

  /**
   * Opening balance plus deposits minus expenses of this month.
   */
  public BigDecimal closingBalance() {
    BigDecimal balance = initialBalance == null ? BigDecimal.ZERO : initialBalance;
    for (JointTransaction transaction : transactions) {
      balance = balance.add(transaction.signedAmount());
    }
    return balance;
  }

  public JointAccount copy() {
    JointAccount copy = new JointAccount(initialBalance);
    transactions.forEach(transaction -> copy.transactions.add(transaction.copy()));
    return copy;
  }
}
