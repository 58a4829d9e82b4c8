package com.monthledger.dto;

import com.monthledger.model.TransactionType;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TransactionRequest {
  private String date;
  private String description;
  private BigDecimal amount;
  private TransactionType type;
  private String person;
}
