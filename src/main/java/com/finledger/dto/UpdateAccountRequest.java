package com.finledger.dto;

import com.finledger.model.AccountType;
import lombok.Getter;
import lombok.Setter;

/** Balance is deliberately absent; only transactions move it. */
@Getter
@Setter
public class UpdateAccountRequest {
  private String name;
  private AccountType type;
  private String color;
  private String icon;
  private Boolean active;
}
