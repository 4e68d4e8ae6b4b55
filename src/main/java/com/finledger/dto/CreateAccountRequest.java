package com.finledger.dto;

import com.finledger.model.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateAccountRequest {
  @NotBlank
  private String name;

  @NotNull
  private AccountType type;

  private BigDecimal openingBalance;
  private String color;
  private String icon;
}
