package com.finledger.engine;

import com.finledger.model.BudgetPeriod;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/** Inclusive date range of the budget period containing a given day. */
public record PeriodWindow(LocalDate start, LocalDate end) {
  private static final int BIWEEKLY_DAYS = 14;

  public static PeriodWindow containing(BudgetPeriod period, LocalDate budgetStart, LocalDate today) {
    return switch (period) {
      case WEEKLY -> {
        LocalDate sunday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        yield new PeriodWindow(sunday, sunday.plusDays(6));
      }
      case BIWEEKLY -> {
        LocalDate anchor = budgetStart == null ? today : budgetStart;
        long cycles = Math.floorDiv(ChronoUnit.DAYS.between(anchor, today), BIWEEKLY_DAYS);
        LocalDate start = anchor.plusDays(cycles * BIWEEKLY_DAYS);
        yield new PeriodWindow(start, start.plusDays(BIWEEKLY_DAYS - 1));
      }
      case MONTHLY -> new PeriodWindow(
          today.withDayOfMonth(1),
          today.with(TemporalAdjusters.lastDayOfMonth()));
      case YEARLY -> new PeriodWindow(
          today.withDayOfYear(1),
          today.with(TemporalAdjusters.lastDayOfYear()));
    };
  }

  public boolean contains(LocalDate date) {
    return date != null && !date.isBefore(start) && !date.isAfter(end);
  }

  /** First day after the window. */
  public LocalDate endExclusive() {
    return end.plusDays(1);
  }
}
