package com.finledger.engine;

import com.finledger.model.AccountTransaction;
import java.math.BigDecimal;

/** A transaction paired with the account balance immediately after it. */
public record ProjectedTransaction(AccountTransaction transaction, BigDecimal runningBalance) {}
