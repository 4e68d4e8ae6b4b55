package com.finledger.engine;

import com.finledger.model.AccountTransaction;
import com.finledger.model.TransactionType;
import java.math.BigDecimal;
import java.util.UUID;

/** Snapshot of the balance-relevant fields of a transaction, taken before it is mutated. */
public record LedgerEntry(UUID transactionId, UUID accountId, TransactionType type, BigDecimal amount) {
  public static LedgerEntry of(AccountTransaction tx) {
    UUID accountId = tx.getAccount() == null ? null : tx.getAccount().getId();
    return new LedgerEntry(tx.getId(), accountId, tx.getType(), tx.getAmount());
  }

  public BigDecimal signedEffect() {
    return type.signedEffect(amount);
  }
}
