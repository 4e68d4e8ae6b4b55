package com.finledger.dto;

import com.finledger.model.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionResponse {
  private UUID id;
  private UUID accountId;
  private TransactionType type;
  private BigDecimal amount;
  private String description;
  private UUID categoryId;
  private LocalDate date;
  private boolean cleared;
  private boolean reconciled;
  private String notes;
  private UUID recurringId;
  /** Balance right after this transaction; only set on per-account listings. */
  private BigDecimal runningBalance;
  private Instant createdAt;
  private Instant updatedAt;
}
