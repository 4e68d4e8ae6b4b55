package com.finledger.dto;

import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SavingsGoalRequest {
  private String name;
  private BigDecimal targetAmount;

  /** Creation only; afterwards the current amount moves through contributions. */
  @PositiveOrZero
  private BigDecimal initialAmount;

  private LocalDate deadline;
  private Boolean clearDeadline;
  private String icon;
  private String color;
}
