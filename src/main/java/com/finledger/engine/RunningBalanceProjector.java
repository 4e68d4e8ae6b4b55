package com.finledger.engine;

import com.finledger.model.AccountTransaction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RunningBalanceProjector {
  static final Comparator<AccountTransaction> CHRONOLOGICAL = Comparator
      .comparing(AccountTransaction::getBookingDate)
      .thenComparing(AccountTransaction::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(AccountTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Running balance after each transaction, newest first. The balance before the oldest
   * transaction is derived from {@code currentBalance}, so the newest row always shows it.
   */
  public List<ProjectedTransaction> project(BigDecimal currentBalance, List<AccountTransaction> transactions) {
    if (transactions == null || transactions.isEmpty()) {
      return List.of();
    }
    List<AccountTransaction> ordered = new ArrayList<>(transactions);
    ordered.sort(CHRONOLOGICAL);

    BigDecimal running = currentBalance.subtract(sumOfEffects(ordered));
    List<ProjectedTransaction> projected = new ArrayList<>(ordered.size());
    for (AccountTransaction tx : ordered) {
      running = running.add(tx.signedEffect());
      projected.add(new ProjectedTransaction(tx, running));
    }
    Collections.reverse(projected);
    return projected;
  }

  /** The balance the account should hold given its opening balance and full history. */
  public BigDecimal reconcile(BigDecimal openingBalance, List<AccountTransaction> transactions) {
    BigDecimal opening = openingBalance == null ? BigDecimal.ZERO : openingBalance;
    if (transactions == null) {
      return opening;
    }
    return opening.add(sumOfEffects(transactions));
  }

  private static BigDecimal sumOfEffects(List<AccountTransaction> transactions) {
    BigDecimal total = BigDecimal.ZERO;
    for (AccountTransaction tx : transactions) {
      total = total.add(tx.signedEffect());
    }
    return total;
  }
}
