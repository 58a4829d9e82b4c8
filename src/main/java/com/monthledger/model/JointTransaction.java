package com.monthledger.model;

import java.math.BigDecimal;
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
public class JointTransaction {
  private String id;
  private String date;
  private String description;
  private BigDecimal amount = BigDecimal.ZERO;
  private TransactionType type = TransactionType.EXPENSE;
  private String person;

  public JointTransaction(String id, String date, String description, BigDecimal amount,
                          TransactionType type, String person) {
    this.id = id;
    this.date = date;
    this.description = description;
    this.amount = amount;
    this.type = type;
    this.person = person;
  }

  public BigDecimal signedAmount() {
    BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
    return type == TransactionType.DEPOSIT ? value : value.negate();
  }

  public JointTransaction copy() {
    return new JointTransaction(id, date, description, amount, type, person);
  }
}
