package com.monthledger.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LinkUserRequest {
  private String userId;
}
