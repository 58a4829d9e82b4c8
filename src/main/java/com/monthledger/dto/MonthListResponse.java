package com.monthledger.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MonthListResponse {
  private List<String> months;
  private String lastViewedMonth;
}
