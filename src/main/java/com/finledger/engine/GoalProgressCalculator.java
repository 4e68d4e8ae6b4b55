package com.finledger.engine;

import com.finledger.config.LedgerProperties;
import com.finledger.model.SavingsGoal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Component;

@Component
public class GoalProgressCalculator {
  private final BigDecimal onTrackBuffer;

  public GoalProgressCalculator(LedgerProperties properties) {
    this.onTrackBuffer = properties.goalOnTrackBuffer() == null ? BigDecimal.TEN : properties.goalOnTrackBuffer();
  }

  public GoalProgress calculate(SavingsGoal goal, ZonedDateTime now) {
    BigDecimal target = goal.getTargetAmount() == null ? BigDecimal.ZERO : goal.getTargetAmount();
    BigDecimal current = goal.getCurrentAmount() == null ? BigDecimal.ZERO : goal.getCurrentAmount();
    BigDecimal percentComplete = Amounts.clamp(
        Amounts.percent(current, target), BigDecimal.ZERO.setScale(2), Amounts.HUNDRED.setScale(2));
    BigDecimal amountRemaining = target.subtract(current).max(BigDecimal.ZERO);

    Long daysUntilDeadline = null;
    BigDecimal expectedProgress = null;
    boolean onTrack = true;
    if (goal.getDeadline() != null) {
      ZoneId zone = now.getZone();
      ZonedDateTime deadline = goal.getDeadline().atStartOfDay(zone);
      long untilDeadline = Amounts.ceilDays(Duration.between(now, deadline).toMillis());
      ZonedDateTime created = goal.getCreatedAt() == null ? now : goal.getCreatedAt().atZone(zone);
      long totalDays = Amounts.ceilDays(Duration.between(created, deadline).toMillis());
      long elapsed = totalDays - untilDeadline;

      expectedProgress = totalDays > 0
          ? BigDecimal.valueOf(elapsed).multiply(Amounts.HUNDRED)
              .divide(BigDecimal.valueOf(totalDays), 2, RoundingMode.HALF_UP)
          : BigDecimal.ZERO.setScale(2);
      onTrack = percentComplete.compareTo(expectedProgress.subtract(onTrackBuffer)) >= 0;
      daysUntilDeadline = untilDeadline;
    }

    return new GoalProgress(
        goal.getId(),
        goal.getName(),
        target,
        current,
        percentComplete,
        amountRemaining,
        goal.getDeadline(),
        daysUntilDeadline,
        expectedProgress,
        onTrack,
        goal.isCompleted(),
        goal.getCompletedAt());
  }
}
