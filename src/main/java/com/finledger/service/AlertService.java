package com.finledger.service;

import com.finledger.dto.AlertResponse;
import com.finledger.dto.AlertResponse.AlertPriority;
import com.finledger.dto.AlertResponse.AlertType;
import com.finledger.engine.BudgetProgress;
import com.finledger.engine.GoalProgress;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Derives owner alerts from budget and goal progress. Nothing is stored. */
@Service
public class AlertService {
  private static final BigDecimal FULL = BigDecimal.valueOf(100);
  private static final int[] MILESTONES = {75, 50, 25};
  private static final BigDecimal MILESTONE_BAND = BigDecimal.valueOf(5);
  private static final Duration RECENT_COMPLETION = Duration.ofDays(7);
  private static final long DEADLINE_HORIZON_DAYS = 14;

  private final BudgetService budgetService;
  private final SavingsGoalService goalService;
  private final Clock clock;

  public AlertService(BudgetService budgetService, SavingsGoalService goalService, Clock clock) {
    this.budgetService = budgetService;
    this.goalService = goalService;
    this.clock = clock;
  }

  public List<AlertResponse> listAlerts(UUID userId) {
    List<AlertResponse> alerts = new ArrayList<>();
    for (BudgetProgress progress : budgetService.listProgress(userId)) {
      budgetAlert(progress, alerts);
    }
    Instant now = clock.instant();
    for (GoalProgress progress : goalService.listProgress(userId)) {
      goalAlerts(progress, now, alerts);
    }
    alerts.sort(Comparator.comparing(AlertResponse::priority));
    return alerts;
  }

  void budgetAlert(BudgetProgress progress, List<AlertResponse> alerts) {
    if (progress.percentUsed().compareTo(FULL) >= 0) {
      alerts.add(budget(AlertType.BUDGET_EXCEEDED, AlertPriority.HIGH, progress));
    } else if (progress.alertTriggered()) {
      alerts.add(budget(AlertType.BUDGET_WARNING, AlertPriority.MEDIUM, progress));
    }
  }

  void goalAlerts(GoalProgress progress, Instant now, List<AlertResponse> alerts) {
    if (progress.completed()) {
      Instant completedAt = progress.completedAt();
      if (completedAt != null && Duration.between(completedAt, now).compareTo(RECENT_COMPLETION) <= 0) {
        alerts.add(goal(AlertType.GOAL_COMPLETED, AlertPriority.LOW, progress));
      }
      return;
    }

    BigDecimal percent = progress.percentComplete();
    for (int milestone : MILESTONES) {
      BigDecimal mark = BigDecimal.valueOf(milestone);
      if (percent.compareTo(mark) >= 0 && percent.compareTo(mark.add(MILESTONE_BAND)) < 0) {
        alerts.add(goal(AlertType.GOAL_MILESTONE, AlertPriority.LOW, progress));
        break;
      }
    }

    Long days = progress.daysUntilDeadline();
    if (days == null) {
      return;
    }
    if (days > 0 && days <= DEADLINE_HORIZON_DAYS) {
      AlertPriority urgency = days <= 3 ? AlertPriority.HIGH : days <= 7 ? AlertPriority.MEDIUM : AlertPriority.LOW;
      alerts.add(goal(AlertType.GOAL_DEADLINE, urgency, progress));
    }
    if (!progress.onTrack() && days > 0) {
      alerts.add(goal(AlertType.GOAL_BEHIND, AlertPriority.MEDIUM, progress));
    }
    if (days < 0) {
      alerts.add(goal(AlertType.GOAL_OVERDUE, AlertPriority.HIGH, progress));
    }
  }

  private AlertResponse budget(AlertType type, AlertPriority priority, BudgetProgress progress) {
    return new AlertResponse(type, priority, progress.budgetId(), progress.name(), progress.percentUsed(), null);
  }

  private AlertResponse goal(AlertType type, AlertPriority priority, GoalProgress progress) {
    return new AlertResponse(
        type, priority, progress.goalId(), progress.name(), progress.percentComplete(), progress.daysUntilDeadline());
  }
}
