package com.finledger.service;

import com.finledger.config.LedgerProperties;
import com.finledger.dto.ReconciliationResponse;
import com.finledger.engine.RunningBalanceProjector;
import com.finledger.exception.InvariantViolationException;
import com.finledger.model.Account;
import com.finledger.repository.AccountRepository;
import com.finledger.repository.AccountTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Recomputes an account balance from its opening balance and full history. Drift beyond the
 * configured epsilon is logged and, unless the check is strict, written back explicitly.
 */
@Service
public class ReconciliationService {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

  private final AccountRepository accountRepository;
  private final AccountTransactionRepository transactionRepository;
  private final AccountService accountService;
  private final RunningBalanceProjector projector;
  private final LedgerProperties properties;
  private final Clock clock;

  public ReconciliationService(AccountRepository accountRepository,
                               AccountTransactionRepository transactionRepository,
                               AccountService accountService,
                               RunningBalanceProjector projector,
                               LedgerProperties properties,
                               Clock clock) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.accountService = accountService;
    this.projector = projector;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional
  public ReconciliationResponse reconcile(UUID userId, UUID accountId, boolean strict) {
    Account account = accountService.requireAccount(userId, accountId);
    return strict ? verify(account) : reconcileAccount(account);
  }

  /** Throws when the stored balance has drifted; never writes. */
  @Transactional(readOnly = true)
  public ReconciliationResponse verify(Account account) {
    ReconciliationResponse result = compute(account);
    if (exceedsEpsilon(result.getDrift())) {
      throw new InvariantViolationException(account.getId(), result.getStoredBalance(), result.getComputedBalance());
    }
    return result;
  }

  @Transactional
  public ReconciliationResponse reconcileAccount(Account account) {
    ReconciliationResponse result = compute(account);
    if (!exceedsEpsilon(result.getDrift())) {
      return result;
    }
    log.warn("Balance drift of {} on account {}: stored {}, recomputed {}; applying recomputed balance",
        result.getDrift().toPlainString(), account.getId(),
        result.getStoredBalance().toPlainString(), result.getComputedBalance().toPlainString());
    accountRepository.overwriteBalance(account.getId(), result.getComputedBalance(), clock.instant());
    return new ReconciliationResponse(
        result.getAccountId(),
        result.getStoredBalance(),
        result.getComputedBalance(),
        result.getDrift(),
        true);
  }

  private ReconciliationResponse compute(Account account) {
    BigDecimal computed = projector.reconcile(
        account.getOpeningBalance(), transactionRepository.findAccountTransactions(account.getId()));
    BigDecimal stored = account.getBalance();
    return new ReconciliationResponse(account.getId(), stored, computed, stored.subtract(computed), false);
  }

  private boolean exceedsEpsilon(BigDecimal drift) {
    return drift.abs().compareTo(properties.reconciliationEpsilon()) > 0;
  }
}
