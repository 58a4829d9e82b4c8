package com.monthledger.ledger;

public enum MoveDirection {
  UP,
  DOWN
}
