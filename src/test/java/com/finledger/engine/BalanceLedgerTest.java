package com.finledger.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.finledger.exception.InvalidAmountException;
import com.finledger.exception.NotFoundException;
import com.finledger.exception.StorageFailureException;
import com.finledger.model.TransactionType;
import com.finledger.repository.AccountRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
@DisplayName("BalanceLedger")
class BalanceLedgerTest {
  private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

  @Mock
  private AccountRepository accountRepository;

  private BalanceLedger ledger;
  private UUID accountId;

  @BeforeEach
  void setUp() {
    ledger = new BalanceLedger(accountRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    accountId = UUID.randomUUID();
  }

  @Test
  @DisplayName("income adds and expense subtracts on create")
  void recordCreate() {
    when(accountRepository.adjustBalance(any(), any(), any())).thenReturn(1);

    assertThat(ledger.recordCreate(accountId, entry(TransactionType.INCOME, "120.50"))).isEqualByComparingTo("120.50");
    assertThat(ledger.recordCreate(accountId, entry(TransactionType.EXPENSE, "20"))).isEqualByComparingTo("-20");
    assertThat(ledger.recordCreate(accountId, entry(TransactionType.TRANSFER_OUT, "5"))).isEqualByComparingTo("-5");
    assertThat(ledger.recordCreate(accountId, entry(TransactionType.TRANSFER_IN, "7"))).isEqualByComparingTo("7");
  }

  @Test
  @DisplayName("edit folds reversal and re-application into one increment")
  void recordEditSingleIncrement() {
    when(accountRepository.adjustBalance(eq(accountId), any(), eq(NOW))).thenReturn(1);

    BigDecimal delta = ledger.recordEdit(accountId,
        entry(TransactionType.EXPENSE, "50"),
        entry(TransactionType.INCOME, "30"));

    ArgumentCaptor<BigDecimal> applied = ArgumentCaptor.forClass(BigDecimal.class);
    verify(accountRepository).adjustBalance(eq(accountId), applied.capture(), eq(NOW));
    assertThat(delta).isEqualByComparingTo("80");
    assertThat(applied.getValue()).isEqualByComparingTo("80");
    assertThat(new BigDecimal("-50").add(delta)).isEqualByComparingTo("30");
  }

  @Test
  @DisplayName("editing only the amount applies the difference")
  void recordEditAmountOnly() {
    when(accountRepository.adjustBalance(any(), any(), any())).thenReturn(1);

    BigDecimal delta = ledger.recordEdit(accountId,
        entry(TransactionType.EXPENSE, "40"),
        entry(TransactionType.EXPENSE, "55"));

    assertThat(delta).isEqualByComparingTo("-15");
  }

  @Test
  @DisplayName("delete reverses the signed effect")
  void recordDelete() {
    when(accountRepository.adjustBalance(any(), any(), any())).thenReturn(1);

    assertThat(ledger.recordDelete(accountId, entry(TransactionType.EXPENSE, "75"))).isEqualByComparingTo("75");
    assertThat(ledger.recordDelete(accountId, entry(TransactionType.INCOME, "75"))).isEqualByComparingTo("-75");
  }

  @Test
  @DisplayName("a missing previous version is reported as not found")
  void editWithoutOldEntry() {
    assertThatThrownBy(() -> ledger.recordEdit(accountId, null, entry(TransactionType.INCOME, "1")))
        .isInstanceOf(NotFoundException.class);
    verifyNoInteractions(accountRepository);
  }

  @Test
  @DisplayName("zero updated rows means the account is gone")
  void accountMissing() {
    when(accountRepository.adjustBalance(any(), any(), any())).thenReturn(0);

    assertThatThrownBy(() -> ledger.recordCreate(accountId, entry(TransactionType.INCOME, "10")))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  @DisplayName("non-positive amounts never reach storage")
  void invalidAmount() {
    assertThatThrownBy(() -> ledger.recordCreate(accountId, entry(TransactionType.EXPENSE, "0")))
        .isInstanceOf(InvalidAmountException.class);
    assertThatThrownBy(() -> ledger.recordCreate(accountId, entry(TransactionType.EXPENSE, "-3")))
        .isInstanceOf(InvalidAmountException.class);
    assertThatThrownBy(() -> ledger.recordCreate(accountId, entry(TransactionType.EXPENSE, null)))
        .isInstanceOf(InvalidAmountException.class);
    verify(accountRepository, never()).adjustBalance(any(), any(), any());
  }

  @Test
  @DisplayName("storage errors surface as retryable storage failures")
  void storageFailure() {
    when(accountRepository.adjustBalance(any(), any(), any()))
        .thenThrow(new QueryTimeoutException("lock wait timeout"));

    assertThatThrownBy(() -> ledger.recordCreate(accountId, entry(TransactionType.INCOME, "10")))
        .isInstanceOf(StorageFailureException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode())
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));
  }

  @Test
  @DisplayName("an edit cannot move a transaction to another account")
  void editAcrossAccounts() {
    LedgerEntry old = new LedgerEntry(UUID.randomUUID(), UUID.randomUUID(), TransactionType.EXPENSE, BigDecimal.TEN);

    assertThatThrownBy(() -> ledger.recordEdit(accountId, old, entry(TransactionType.EXPENSE, "10")))
        .isInstanceOf(ResponseStatusException.class)
        .hasMessageContaining("cannot move");
  }

  private LedgerEntry entry(TransactionType type, String amount) {
    return new LedgerEntry(UUID.randomUUID(), accountId, type, amount == null ? null : new BigDecimal(amount));
  }
}
