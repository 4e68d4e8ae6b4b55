package com.finledger.dto;

import com.finledger.model.TransactionType;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateTransactionRequest {
  /** Only accepted when it names the transaction's current account. */
  private UUID accountId;
  private TransactionType type;

  @Positive
  private BigDecimal amount;

  private String description;
  private UUID categoryId;
  private Boolean clearCategory;
  private LocalDate date;
  private Boolean cleared;
  private Boolean reconciled;
  private String notes;
}
