package com.monthledger.dto;

import com.monthledger.service.ClientSession;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SessionResponse {
  private String userId;
  private ClientSession.Status status;
  private boolean offline;
  private List<String> months;
  private String currentMonth;
  private String lastViewedMonth;
}
