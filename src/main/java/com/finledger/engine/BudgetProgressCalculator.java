package com.finledger.engine;

import com.finledger.model.AccountTransaction;
import com.finledger.model.Budget;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Spend within the current period of a budget. Pure; callers supply the transactions and the clock reading. */
@Component
public class BudgetProgressCalculator {

  public PeriodWindow currentWindow(Budget budget, ZonedDateTime now) {
    return PeriodWindow.containing(budget.getPeriod(), budget.getStartDate(), now.toLocalDate());
  }

  public BudgetProgress calculate(Budget budget, List<AccountTransaction> transactions, ZonedDateTime now) {
    PeriodWindow window = currentWindow(budget, now);
    BigDecimal spent = BigDecimal.ZERO;
    for (AccountTransaction tx : transactions) {
      if (tx.getType() == null || tx.getType().isCredit() || tx.getAmount() == null) {
        continue;
      }
      if (!window.contains(tx.getBookingDate())) {
        continue;
      }
      if (budget.getCategoryId() != null && !Objects.equals(budget.getCategoryId(), tx.getCategoryId())) {
        continue;
      }
      spent = spent.add(tx.getAmount());
    }

    BigDecimal amount = budget.getAmount() == null ? BigDecimal.ZERO : budget.getAmount();
    BigDecimal percentUsed = Amounts.percent(spent, amount).min(Amounts.HUNDRED.setScale(2));
    boolean overBudget = spent.compareTo(amount) > 0;

    ZonedDateTime windowEnd = window.endExclusive().atStartOfDay(now.getZone());
    long daysRemaining = Math.max(0, Amounts.ceilDays(Duration.between(now, windowEnd).toMillis()));
    boolean alertTriggered = percentUsed.compareTo(BigDecimal.valueOf(budget.getAlertThreshold())) >= 0;

    return new BudgetProgress(
        budget.getId(),
        budget.getName(),
        budget.getCategoryId(),
        budget.getPeriod(),
        window.start(),
        window.end(),
        amount,
        spent,
        amount.subtract(spent),
        percentUsed,
        overBudget,
        daysRemaining,
        budget.getAlertThreshold(),
        alertTriggered);
  }
}
