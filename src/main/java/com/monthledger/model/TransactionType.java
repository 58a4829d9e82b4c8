package com.monthledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TransactionType {
  DEPOSIT("deposit"),
  EXPENSE("expense");

  private final String value;

  TransactionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Anything that is not a deposit counts against the balance.
   */
  @JsonCreator
  public static TransactionType fromValue(String value) {
    if (value != null && DEPOSIT.value.equals(value.trim().toLowerCase(Locale.ROOT))) {
      return DEPOSIT;
    }
    return EXPENSE;
  }
}
