package com.finledger.engine;

import com.finledger.exception.InvalidAmountException;
import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Amounts {
  static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  static final long DAY_MILLIS = 86_400_000L;

  private Amounts() {
  }

  public static BigDecimal requirePositive(BigDecimal amount, String field) {
    if (amount == null) {
      throw new InvalidAmountException(field + " is required");
    }
    if (amount.signum() <= 0) {
      throw new InvalidAmountException(field + " must be greater than zero");
    }
    return amount;
  }

  /** part / whole * 100 at two decimals, zero when whole is not positive. */
  static BigDecimal percent(BigDecimal part, BigDecimal whole) {
    if (whole == null || whole.signum() <= 0 || part == null) {
      return BigDecimal.ZERO.setScale(2);
    }
    return part.multiply(HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
  }

  static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
    return value.max(min).min(max);
  }

  /** Millisecond span in whole days, rounded up. Negative spans stay negative. */
  static long ceilDays(long millis) {
    return -Math.floorDiv(-millis, DAY_MILLIS);
  }
}
