package com.finledger.service;

import com.finledger.config.ReconciliationProperties;
import com.finledger.dto.ReconciliationResponse;
import com.finledger.model.Account;
import com.finledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReconciliationScheduler {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

  private final AccountRepository accountRepository;
  private final ReconciliationService reconciliationService;
  private final ReconciliationProperties properties;

  public ReconciliationScheduler(AccountRepository accountRepository,
                                 ReconciliationService reconciliationService,
                                 ReconciliationProperties properties) {
    this.accountRepository = accountRepository;
    this.reconciliationService = reconciliationService;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${finledger.reconciliation.interval-ms:3600000}")
  public void run() {
    if (!properties.enabled()) {
      return;
    }
    int corrected = 0;
    int failed = 0;
    for (Account account : accountRepository.findByActiveTrue()) {
      try {
        ReconciliationResponse result = reconciliationService.reconcileAccount(account);
        if (result.isCorrected()) {
          corrected++;
        }
      } catch (RuntimeException ex) {
        failed++;
        log.warn("Reconciliation failed for account {}: {}", account.getId(), ex.getMessage());
      }
    }
    if (corrected > 0 || failed > 0) {
      log.info("Reconciliation run corrected {} account(s), {} failed", corrected, failed);
    }
  }
}
