package com.finledger.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ContributionResponse {
  private UUID id;
  private UUID goalId;
  private BigDecimal amount;
  private String note;
  private LocalDate date;
  private Instant createdAt;
}
