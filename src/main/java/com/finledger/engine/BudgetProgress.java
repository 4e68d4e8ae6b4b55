package com.finledger.engine;

import com.finledger.model.BudgetPeriod;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record BudgetProgress(
    UUID budgetId,
    String name,
    UUID categoryId,
    BudgetPeriod period,
    LocalDate windowStart,
    LocalDate windowEnd,
    BigDecimal amount,
    BigDecimal spent,
    BigDecimal remaining,
    BigDecimal percentUsed,
    boolean overBudget,
    long daysRemaining,
    int alertThreshold,
    boolean alertTriggered) {}
