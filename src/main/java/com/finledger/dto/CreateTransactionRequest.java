package com.finledger.dto;

import com.finledger.model.TransactionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateTransactionRequest {
  @NotNull
  private UUID accountId;

  @NotNull
  private TransactionType type;

  @NotNull
  @Positive
  private BigDecimal amount;

  private String description;
  private UUID categoryId;
  private LocalDate date;
  private Boolean cleared;
  private String notes;
}
