package com.monthledger.ledger;

/**
 * What to do when later copies of an edited line no longer hold the values the edited copy had
 * before the edit.
 */
public enum ConflictPolicy {
  ALWAYS_OVERWRITE,
  NEVER_OVERWRITE,
  ASK_CALLER
}
