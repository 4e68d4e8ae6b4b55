package com.finledger.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SavingsGoalResponse {
  private UUID id;
  private String name;
  private BigDecimal targetAmount;
  private BigDecimal initialAmount;
  private BigDecimal currentAmount;
  private LocalDate deadline;
  private String icon;
  private String color;
  private boolean completed;
  private Instant completedAt;
  private Instant createdAt;
  private Instant updatedAt;
}
