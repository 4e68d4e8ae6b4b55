package com.finledger.dto;

import com.finledger.model.RecurringFrequency;
import com.finledger.model.TransactionType;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RecurringRequest {
  private UUID accountId;
  private TransactionType type;

  @Positive
  private BigDecimal amount;

  private String description;
  private UUID categoryId;
  private RecurringFrequency frequency;
  private LocalDate startDate;
  private LocalDate endDate;
  private Boolean clearEndDate;
  private Boolean active;
}
