package com.monthledger.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SessionRequest {
  @NotBlank
  private String userId;
  @NotBlank
  private String accessToken;
}
