package com.finledger.service;

import com.finledger.dto.ContributionRequest;
import com.finledger.dto.ContributionResponse;
import com.finledger.dto.SavingsGoalRequest;
import com.finledger.dto.SavingsGoalResponse;
import com.finledger.engine.Amounts;
import com.finledger.engine.GoalProgress;
import com.finledger.engine.GoalProgressCalculator;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.InvalidAmountException;
import com.finledger.exception.NotFoundException;
import com.finledger.model.GoalContribution;
import com.finledger.model.SavingsGoal;
import com.finledger.repository.GoalContributionRepository;
import com.finledger.repository.SavingsGoalRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class SavingsGoalService {
  private static final Logger log = LoggerFactory.getLogger(SavingsGoalService.class);

  private final SavingsGoalRepository goalRepository;
  private final GoalContributionRepository contributionRepository;
  private final GoalProgressCalculator progressCalculator;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public SavingsGoalService(SavingsGoalRepository goalRepository,
                            GoalContributionRepository contributionRepository,
                            GoalProgressCalculator progressCalculator,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
    this.goalRepository = goalRepository;
    this.contributionRepository = contributionRepository;
    this.progressCalculator = progressCalculator;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public List<SavingsGoalResponse> listGoals(UUID userId) {
    return goalRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
        .map(this::toResponse)
        .toList();
  }

  public SavingsGoalResponse getGoal(UUID userId, UUID goalId) {
    return toResponse(requireGoal(userId, goalId));
  }

  public SavingsGoalResponse createGoal(UUID userId, SavingsGoalRequest request) {
    SavingsGoal goal = new SavingsGoal();
    goal.setUserId(userId);
    goal.setName(requireText(request.getName(), "name"));
    goal.setTargetAmount(Amounts.requirePositive(request.getTargetAmount(), "targetAmount"));
    BigDecimal initial = request.getInitialAmount() == null ? BigDecimal.ZERO : request.getInitialAmount();
    if (initial.signum() < 0) {
      throw new InvalidAmountException("initialAmount must not be negative");
    }
    goal.setInitialAmount(initial);
    goal.setCurrentAmount(initial);
    goal.setDeadline(request.getDeadline());
    goal.setIcon(request.getIcon());
    goal.setColor(request.getColor());
    markCompletedIfReached(goal);
    SavingsGoal saved = goalRepository.save(goal);
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved);
  }

  /**
   * Updates goal metadata. A changed initial amount shifts the current amount by the same
   * difference so the current amount stays initial plus contributions.
   */
  @Transactional
  public SavingsGoalResponse updateGoal(UUID userId, UUID goalId, SavingsGoalRequest request) {
    SavingsGoal goal = requireGoal(userId, goalId);
    if (request.getName() != null) {
      goal.setName(requireText(request.getName(), "name"));
    }
    if (request.getTargetAmount() != null) {
      goal.setTargetAmount(Amounts.requirePositive(request.getTargetAmount(), "targetAmount"));
    }
    if (request.getInitialAmount() != null) {
      if (request.getInitialAmount().signum() < 0) {
        throw new InvalidAmountException("initialAmount must not be negative");
      }
      BigDecimal shift = request.getInitialAmount().subtract(goal.getInitialAmount());
      goal.setInitialAmount(request.getInitialAmount());
      goal.setCurrentAmount(goal.getCurrentAmount().add(shift));
    }
    if (Boolean.TRUE.equals(request.getClearDeadline())) {
      goal.setDeadline(null);
    } else if (request.getDeadline() != null) {
      goal.setDeadline(request.getDeadline());
    }
    if (request.getIcon() != null) {
      goal.setIcon(request.getIcon());
    }
    if (request.getColor() != null) {
      goal.setColor(request.getColor());
    }
    markCompletedIfReached(goal);
    SavingsGoal saved = goalRepository.save(goal);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  @Transactional
  public void deleteGoal(UUID userId, UUID goalId) {
    SavingsGoal goal = requireGoal(userId, goalId);
    int removed = contributionRepository.deleteByGoalId(goal.getId());
    goalRepository.delete(goal);
    log.debug("Deleted goal {} with {} contribution(s)", goalId, removed);
    publish(userId, goalId, ChangeKind.DELETED);
  }

  /** Appends a contribution and raises the goal's current amount in the same storage transaction. */
  @Transactional
  public SavingsGoalResponse contribute(UUID userId, UUID goalId, ContributionRequest request) {
    BigDecimal amount = Amounts.requirePositive(request.getAmount(), "amount");
    SavingsGoal goal = requireGoal(userId, goalId);

    GoalContribution contribution = new GoalContribution();
    contribution.setGoal(goal);
    contribution.setUserId(userId);
    contribution.setAmount(amount);
    contribution.setNote(request.getNote());
    contribution.setContributionDate(request.getDate() == null ? LocalDate.now(clock) : request.getDate());
    contributionRepository.save(contribution);

    goal.setCurrentAmount(goal.getCurrentAmount().add(amount));
    if (markCompletedIfReached(goal)) {
      log.info("Goal {} reached its target of {}", goal.getId(), goal.getTargetAmount().toPlainString());
    }
    SavingsGoal saved = goalRepository.save(goal);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  public List<ContributionResponse> listContributions(UUID userId, UUID goalId) {
    SavingsGoal goal = requireGoal(userId, goalId);
    return contributionRepository.findGoalContributions(goal.getId()).stream()
        .map(contribution -> new ContributionResponse(
            contribution.getId(),
            goal.getId(),
            contribution.getAmount(),
            contribution.getNote(),
            contribution.getContributionDate(),
            contribution.getCreatedAt()))
        .toList();
  }

  public List<GoalProgress> listProgress(UUID userId) {
    ZonedDateTime now = ZonedDateTime.now(clock);
    return goalRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
        .map(goal -> progressCalculator.calculate(goal, now))
        .toList();
  }

  public GoalProgress getProgress(UUID userId, UUID goalId) {
    return progressCalculator.calculate(requireGoal(userId, goalId), ZonedDateTime.now(clock));
  }

  /** Completion only moves from false to true; falling below the target later keeps it completed. */
  private boolean markCompletedIfReached(SavingsGoal goal) {
    if (goal.isCompleted() || goal.getCurrentAmount().compareTo(goal.getTargetAmount()) < 0) {
      return false;
    }
    goal.setCompleted(true);
    goal.setCompletedAt(clock.instant());
    return true;
  }

  private SavingsGoal requireGoal(UUID userId, UUID goalId) {
    SavingsGoal goal = goalRepository.findById(goalId)
        .orElseThrow(() -> new NotFoundException("Goal not found"));
    if (!goal.getUserId().equals(userId)) {
      throw new NotFoundException("Goal not found");
    }
    return goal;
  }

  private void publish(UUID userId, UUID goalId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.GOALS, goalId, kind));
  }

  private String requireText(String value, String field) {
    if (value == null || value.trim().isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
    }
    return value.trim();
  }

  private SavingsGoalResponse toResponse(SavingsGoal goal) {
    return new SavingsGoalResponse(
        goal.getId(),
        goal.getName(),
        goal.getTargetAmount(),
        goal.getInitialAmount(),
        goal.getCurrentAmount(),
        goal.getDeadline(),
        goal.getIcon(),
        goal.getColor(),
        goal.isCompleted(),
        goal.getCompletedAt(),
        goal.getCreatedAt(),
        goal.getUpdatedAt()
    );
  }
}
