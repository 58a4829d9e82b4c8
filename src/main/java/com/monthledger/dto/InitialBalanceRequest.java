package com.monthledger.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class InitialBalanceRequest {
  @NotNull
  private BigDecimal amount;
}
