package com.monthledger.ledger;

public class EntryNotFoundException extends RuntimeException {
  public EntryNotFoundException(String message) {
    super(message);
  }
}
