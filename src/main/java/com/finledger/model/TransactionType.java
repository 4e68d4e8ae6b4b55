package com.finledger.model;

import java.math.BigDecimal;

public enum TransactionType {
  INCOME(true),
  EXPENSE(false),
  TRANSFER_IN(true),
  TRANSFER_OUT(false);

  private final boolean credit;

  TransactionType(boolean credit) {
    this.credit = credit;
  }

  /** Income-like types add to the balance, expense-like types subtract from it. */
  public boolean isCredit() {
    return credit;
  }

  public BigDecimal signedEffect(BigDecimal amount) {
    if (amount == null) {
      return BigDecimal.ZERO;
    }
    return credit ? amount : amount.negate();
  }
}
