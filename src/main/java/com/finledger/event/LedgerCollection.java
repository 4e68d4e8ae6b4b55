package com.finledger.event;

public enum LedgerCollection {
  ACCOUNTS,
  TRANSACTIONS,
  CATEGORIES,
  BUDGETS,
  GOALS,
  RECURRING
}
