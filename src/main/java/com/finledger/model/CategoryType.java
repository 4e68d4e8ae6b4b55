package com.finledger.model;

public enum CategoryType {
  EXPENSE,
  INCOME
}
