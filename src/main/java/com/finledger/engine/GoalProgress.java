package com.finledger.engine;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** {@code daysUntilDeadline} and {@code expectedProgress} are null for goals without a deadline. */
public record GoalProgress(
    UUID goalId,
    String name,
    BigDecimal targetAmount,
    BigDecimal currentAmount,
    BigDecimal percentComplete,
    BigDecimal amountRemaining,
    LocalDate deadline,
    Long daysUntilDeadline,
    BigDecimal expectedProgress,
    boolean onTrack,
    boolean completed,
    Instant completedAt) {}
