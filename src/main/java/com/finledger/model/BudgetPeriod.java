package com.finledger.model;

public enum BudgetPeriod {
  WEEKLY,
  BIWEEKLY,
  MONTHLY,
  YEARLY
}
