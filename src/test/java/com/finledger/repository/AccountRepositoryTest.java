package com.finledger.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.finledger.model.Account;
import com.finledger.model.AccountType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("AccountRepository")
class AccountRepositoryTest {
  private static final Instant UPDATED_AT = Instant.parse("2026-03-15T10:00:00Z");

  @Autowired
  private AccountRepository accountRepository;

  @Autowired
  private TestEntityManager entityManager;

  private Account account;

  @BeforeEach
  void setUp() {
    account = new Account();
    account.setUserId(UUID.randomUUID());
    account.setName("Checking");
    account.setType(AccountType.CHECKING);
    account.setOpeningBalance(new BigDecimal("1000.00"));
    account.setBalance(new BigDecimal("1000.00"));
    account = entityManager.persistFlushFind(account);
  }

  @Test
  @DisplayName("adjustBalance adds the delta to the stored balance")
  void adjustBalance() {
    int rows = accountRepository.adjustBalance(account.getId(), new BigDecimal("-200.00"), UPDATED_AT);
    accountRepository.adjustBalance(account.getId(), new BigDecimal("35.50"), UPDATED_AT);

    Account reloaded = accountRepository.findById(account.getId()).orElseThrow();
    assertThat(rows).isEqualTo(1);
    assertThat(reloaded.getBalance()).isEqualByComparingTo("835.50");
    assertThat(reloaded.getOpeningBalance()).isEqualByComparingTo("1000.00");
    assertThat(reloaded.getUpdatedAt()).isEqualTo(UPDATED_AT);
  }

  @Test
  @DisplayName("adjustBalance touches nothing for an unknown account")
  void adjustUnknown() {
    int rows = accountRepository.adjustBalance(UUID.randomUUID(), BigDecimal.TEN, UPDATED_AT);

    assertThat(rows).isZero();
  }

  @Test
  @DisplayName("overwriteBalance replaces the stored balance")
  void overwriteBalance() {
    accountRepository.overwriteBalance(account.getId(), new BigDecimal("42.00"), UPDATED_AT);

    assertThat(accountRepository.findById(account.getId()).orElseThrow().getBalance())
        .isEqualByComparingTo("42.00");
  }

  @Test
  @DisplayName("only active accounts are listed for the scheduled check")
  void activeAccounts() {
    Account closed = new Account();
    closed.setUserId(account.getUserId());
    closed.setName("Old savings");
    closed.setType(AccountType.SAVINGS);
    closed.setOpeningBalance(BigDecimal.ZERO);
    closed.setBalance(BigDecimal.ZERO);
    closed.setActive(false);
    entityManager.persistAndFlush(closed);

    assertThat(accountRepository.findByActiveTrue())
        .extracting(Account::getId)
        .containsExactly(account.getId());
  }
}
