package com.finledger.dto;

import com.finledger.model.AccountType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountResponse {
  private UUID id;
  private String name;
  private AccountType type;
  private BigDecimal balance;
  private BigDecimal openingBalance;
  private String color;
  private String icon;
  private boolean active;
  private Instant createdAt;
  private Instant updatedAt;
}
