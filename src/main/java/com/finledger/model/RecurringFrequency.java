package com.finledger.model;

import java.time.LocalDate;

public enum RecurringFrequency {
  DAILY,
  WEEKLY,
  BIWEEKLY,
  MONTHLY,
  YEARLY;

  /**
   * Next occurrence after {@code from}. Month and year steps keep the day of month and roll
   * surplus days into the following month instead of clamping: Jan 31 + 1 month is Mar 3
   * (Mar 2 in leap years) and Feb 29 + 1 year is Mar 1.
   */
  public LocalDate next(LocalDate from) {
    return switch (this) {
      case DAILY -> from.plusDays(1);
      case WEEKLY -> from.plusWeeks(1);
      case BIWEEKLY -> from.plusWeeks(2);
      case MONTHLY -> rollOver(from.withDayOfMonth(1).plusMonths(1), from);
      case YEARLY -> rollOver(from.withDayOfMonth(1).plusYears(1), from);
    };
  }

  private static LocalDate rollOver(LocalDate firstOfTargetMonth, LocalDate from) {
    return firstOfTargetMonth.plusDays(from.getDayOfMonth() - 1L);
  }
}
