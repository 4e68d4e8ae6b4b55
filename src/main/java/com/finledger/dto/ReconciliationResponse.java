package com.finledger.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ReconciliationResponse {
  private UUID accountId;
  private BigDecimal storedBalance;
  private BigDecimal computedBalance;
  private BigDecimal drift;
  private boolean corrected;
}
