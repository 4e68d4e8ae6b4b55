package com.finledger.exception;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Stored balance differs from the balance recomputed from the account's transactions. */
@Getter
public class InvariantViolationException extends ResponseStatusException {
  private final UUID accountId;
  private final BigDecimal storedBalance;
  private final BigDecimal computedBalance;

  public InvariantViolationException(UUID accountId, BigDecimal storedBalance, BigDecimal computedBalance) {
    super(HttpStatus.CONFLICT, "Balance drift on account " + accountId
        + ": stored " + storedBalance.toPlainString()
        + ", recomputed " + computedBalance.toPlainString());
    this.accountId = accountId;
    this.storedBalance = storedBalance;
    this.computedBalance = computedBalance;
  }
}
