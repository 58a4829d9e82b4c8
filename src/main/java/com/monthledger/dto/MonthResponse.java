package com.monthledger.dto;

import com.monthledger.ledger.BudgetTotals;
import com.monthledger.model.BudgetData;
import com.monthledger.sync.SyncState;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MonthResponse {
  private String monthKey;
  private BudgetData data;
  private BudgetTotals totals;
  private SyncState syncState;
}
