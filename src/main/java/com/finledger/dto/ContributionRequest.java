package com.finledger.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ContributionRequest {
  @NotNull
  @Positive
  private BigDecimal amount;

  private String note;
  private LocalDate date;
}
