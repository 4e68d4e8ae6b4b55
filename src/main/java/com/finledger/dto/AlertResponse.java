package com.finledger.dto;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A condition worth surfacing to the owner. {@code percent} is the budget's percent used or the
 * goal's percent complete; {@code daysUntilDeadline} is only set for goal alerts.
 */
public record AlertResponse(
    AlertType type,
    AlertPriority priority,
    UUID subjectId,
    String subjectName,
    BigDecimal percent,
    Long daysUntilDeadline) {

  public enum AlertType {
    BUDGET_EXCEEDED,
    BUDGET_WARNING,
    GOAL_COMPLETED,
    GOAL_MILESTONE,
    GOAL_DEADLINE,
    GOAL_BEHIND,
    GOAL_OVERDUE
  }

  /** Declared high to low; sorting uses the ordinal. */
  public enum AlertPriority {
    HIGH,
    MEDIUM,
    LOW
  }
}
