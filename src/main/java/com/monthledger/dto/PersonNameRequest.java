package com.monthledger.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PersonNameRequest {
  @NotNull
  private String name;
}
