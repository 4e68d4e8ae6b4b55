package com.finledger.model;

public enum AccountType {
  CHECKING,
  SAVINGS,
  CREDIT_CARD,
  CASH,
  INVESTMENT,
  OTHER
}
