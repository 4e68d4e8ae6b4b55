package com.finledger.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.finledger.model.Account;
import com.finledger.model.AccountTransaction;
import com.finledger.model.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RunningBalanceProjector")
class RunningBalanceProjectorTest {
  private final RunningBalanceProjector projector = new RunningBalanceProjector();
  private Account account;

  @BeforeEach
  void setUp() {
    account = new Account();
    account.setId(UUID.randomUUID());
  }

  @Test
  @DisplayName("returns an empty list for an account without transactions")
  void emptyHistory() {
    assertThat(projector.project(new BigDecimal("250.00"), List.of())).isEmpty();
  }

  @Test
  @DisplayName("lists newest first and the newest row carries the current balance")
  void newestFirst() {
    AccountTransaction salary = tx(TransactionType.INCOME, "1000", LocalDate.of(2026, 3, 1), 1);
    AccountTransaction rent = tx(TransactionType.EXPENSE, "800", LocalDate.of(2026, 3, 2), 2);
    AccountTransaction groceries = tx(TransactionType.EXPENSE, "50", LocalDate.of(2026, 3, 5), 3);

    List<ProjectedTransaction> projected =
        projector.project(new BigDecimal("650"), List.of(rent, groceries, salary));

    assertThat(projected).extracting(ProjectedTransaction::transaction)
        .containsExactly(groceries, rent, salary);
    assertThat(projected).extracting(ProjectedTransaction::runningBalance)
        .usingElementComparator(BigDecimal::compareTo)
        .containsExactly(new BigDecimal("650"), new BigDecimal("700"), new BigDecimal("1500"));
  }

  @Test
  @DisplayName("derives the starting balance from the current balance")
  void startingBalanceDerived() {
    AccountTransaction deposit = tx(TransactionType.TRANSFER_IN, "100", LocalDate.of(2026, 3, 1), 1);

    List<ProjectedTransaction> projected = projector.project(new BigDecimal("600"), List.of(deposit));

    BigDecimal startingBalance = projected.get(0).runningBalance().subtract(deposit.signedEffect());
    assertThat(startingBalance).isEqualByComparingTo("500");
  }

  @Test
  @DisplayName("produces the same balances whatever order the history arrives in")
  void orderIndependent() {
    List<AccountTransaction> history = new ArrayList<>();
    history.add(tx(TransactionType.INCOME, "1200", LocalDate.of(2026, 2, 1), 1));
    history.add(tx(TransactionType.EXPENSE, "45.10", LocalDate.of(2026, 2, 3), 2));
    history.add(tx(TransactionType.TRANSFER_OUT, "300", LocalDate.of(2026, 2, 3), 3));
    history.add(tx(TransactionType.EXPENSE, "19.99", LocalDate.of(2026, 2, 10), 4));
    history.add(tx(TransactionType.TRANSFER_IN, "75", LocalDate.of(2026, 2, 11), 5));

    List<ProjectedTransaction> expected = projector.project(new BigDecimal("909.91"), history);
    List<AccountTransaction> shuffled = new ArrayList<>(history);
    Collections.reverse(shuffled);
    Collections.swap(shuffled, 0, 3);

    List<ProjectedTransaction> actual = projector.project(new BigDecimal("909.91"), shuffled);

    assertThat(actual).isEqualTo(expected);
  }

  @Test
  @DisplayName("breaks same-day ties by creation time")
  void sameDayTieBreak() {
    LocalDate day = LocalDate.of(2026, 3, 10);
    AccountTransaction first = tx(TransactionType.EXPENSE, "10", day, 1);
    AccountTransaction second = tx(TransactionType.EXPENSE, "20", day, 2);

    List<ProjectedTransaction> projected = projector.project(new BigDecimal("70"), List.of(second, first));

    assertThat(projected.get(0).transaction()).isSameAs(second);
    assertThat(projected.get(0).runningBalance()).isEqualByComparingTo("70");
    assertThat(projected.get(1).runningBalance()).isEqualByComparingTo("90");
  }

  @Test
  @DisplayName("reconcile sums the history onto the opening balance")
  void reconcile() {
    List<AccountTransaction> history = List.of(
        tx(TransactionType.INCOME, "100", LocalDate.of(2026, 1, 1), 1),
        tx(TransactionType.EXPENSE, "30", LocalDate.of(2026, 1, 2), 2));

    assertThat(projector.reconcile(new BigDecimal("50"), history)).isEqualByComparingTo("120");
    assertThat(projector.reconcile(null, List.of())).isEqualByComparingTo("0");
  }

  private AccountTransaction tx(TransactionType type, String amount, LocalDate date, int sequence) {
    AccountTransaction tx = new AccountTransaction();
    tx.setId(UUID.randomUUID());
    tx.setAccount(account);
    tx.setType(type);
    tx.setAmount(new BigDecimal(amount));
    tx.setBookingDate(date);
    tx.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z").plusSeconds(sequence));
    return tx;
  }
}
