package com.finledger.dto;

import com.finledger.model.BudgetPeriod;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BudgetResponse {
  private UUID id;
  private String name;
  private UUID categoryId;
  private BigDecimal amount;
  private BudgetPeriod period;
  private LocalDate startDate;
  private int alertThreshold;
  private boolean active;
  private Instant createdAt;
  private Instant updatedAt;
}
