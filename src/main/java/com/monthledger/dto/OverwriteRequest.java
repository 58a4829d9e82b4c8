package com.monthledger.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class OverwriteRequest {
  @NotEmpty
  private List<String> months;
}
