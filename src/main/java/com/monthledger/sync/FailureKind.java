package com.monthledger.sync;

public enum FailureKind {
  /** Terminal for the whole flush; the session has ended. */
  UNAUTHORIZED,
  /** Permanent; retrying will not change the outcome. */
  CLIENT_REJECTED,
  /** Timeouts, server errors, connectivity loss. */
  TRANSIENT
}
