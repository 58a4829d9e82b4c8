package com.monthledger.dto;

import com.monthledger.service.ClientSession;
import com.monthledger.sync.SyncState;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncStatusResponse {
  private boolean online;
  private ClientSession.Status session;
  private boolean flushInProgress;
  private int queuedWrites;
  private int queuedDeletes;
  private boolean settingsPending;
  private int dirtyMonths;
  private Map<String, SyncState> months;
}
