package com.monthledger.sync;

public enum SyncState {
  CLEAN,
  DIRTY,
  QUEUED,
  RECONCILING
}
