package com.finledger.dto;

import com.finledger.model.BudgetPeriod;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class BudgetRequest {
  private String name;
  private UUID categoryId;
  private Boolean overall;

  @Positive
  private BigDecimal amount;

  private BudgetPeriod period;
  private LocalDate startDate;

  @Min(0)
  @Max(100)
  private Integer alertThreshold;

  private Boolean active;
}
