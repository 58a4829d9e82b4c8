package com.monthledger.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PropagationResponse {
  private String lineId;
  private String templateId;
  private List<String> touchedMonths;
  private List<String> skippedDivergentMonths;
}
