package com.finledger.dto;

import com.finledger.model.RecurringFrequency;
import com.finledger.model.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RecurringResponse {
  private UUID id;
  private UUID accountId;
  private TransactionType type;
  private BigDecimal amount;
  private String description;
  private UUID categoryId;
  private RecurringFrequency frequency;
  private LocalDate startDate;
  private LocalDate nextDate;
  private LocalDate endDate;
  private boolean active;
  private LocalDate lastGeneratedDate;
  private Instant createdAt;
  private Instant updatedAt;
}
