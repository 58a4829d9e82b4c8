package com.monthledger.dto;

import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

/**
 * Line values for create and update. On update, absent fields stay unchanged.
 */
@Getter
@Setter
public class LineRequest {
  private String name;
  private BigDecimal amount;
  private String categoryOverrideId;
  private String icon;
  private String date;
  private String account;
  private Boolean checked;
  private Boolean recurring;
  @Positive
  private Integer recurringMonths;
  private String startMonth;
  private Boolean propagate;
}
