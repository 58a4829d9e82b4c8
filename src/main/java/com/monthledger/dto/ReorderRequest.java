package com.monthledger.dto;

import com.monthledger.ledger.MoveDirection;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ReorderRequest {
  @NotNull
  private MoveDirection direction;
}
