package com.monthledger.ledger;

import com.monthledger.model.JointTransaction;
import com.monthledger.model.TransactionType;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TransactionPatch {
  private String date;
  private String description;
  private BigDecimal amount;
  private TransactionType type;
  private String person;

  void applyTo(JointTransaction transaction) {
    if (date != null) {
      transaction.setDate(date);
    }
    if (description != null) {
      transaction.setDescription(description);
    }
    if (amount != null) {
      transaction.setAmount(Amounts.canonical(amount));
    }
    if (type != null) {
      transaction.setType(type);
    }
    if (person != null) {
      transaction.setPerson(person);
    }
  }
}
