package com.finledger.engine;

import com.finledger.exception.NotFoundException;
import com.finledger.exception.StorageFailureException;
import com.finledger.repository.AccountRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * The only writer of {@code Account.balance} for transaction changes. Every operation folds its
 * effect into a single delta and applies it with one atomic increment, so a reversed but not yet
 * re-applied balance is never stored.
 */
@Component
public class BalanceLedger {
  private static final Logger log = LoggerFactory.getLogger(BalanceLedger.class);

  private final AccountRepository accountRepository;
  private final Clock clock;

  public BalanceLedger(AccountRepository accountRepository, Clock clock) {
    this.accountRepository = accountRepository;
    this.clock = clock;
  }

  public BigDecimal recordCreate(UUID accountId, LedgerEntry entry) {
    validate(entry);
    return apply(accountId, entry.signedEffect());
  }

  /** Reverses {@code oldEntry} and applies {@code newEntry}; the type may change between them. */
  public BigDecimal recordEdit(UUID accountId, LedgerEntry oldEntry, LedgerEntry newEntry) {
    if (oldEntry == null) {
      throw new NotFoundException("Transaction not found");
    }
    validate(newEntry);
    if (oldEntry.accountId() != null && !oldEntry.accountId().equals(accountId)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Transactions cannot move between accounts");
    }
    BigDecimal delta = oldEntry.signedEffect().negate().add(newEntry.signedEffect());
    return apply(accountId, delta);
  }

  public BigDecimal recordDelete(UUID accountId, LedgerEntry entry) {
    if (entry == null) {
      throw new NotFoundException("Transaction not found");
    }
    return apply(accountId, entry.signedEffect().negate());
  }

  private BigDecimal apply(UUID accountId, BigDecimal delta) {
    int updated;
    try {
      updated = accountRepository.adjustBalance(accountId, delta, clock.instant());
    } catch (DataAccessException ex) {
      throw new StorageFailureException("Balance update failed for account " + accountId, ex);
    }
    if (updated == 0) {
      throw new NotFoundException("Account not found");
    }
    log.debug("Applied balance delta {} to account {}", delta.toPlainString(), accountId);
    return delta;
  }

  private void validate(LedgerEntry entry) {
    if (entry == null || entry.type() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Transaction type is required");
    }
    Amounts.requirePositive(entry.amount(), "Amount");
  }
}
