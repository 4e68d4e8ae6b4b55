package com.finledger.service;

import com.finledger.config.LedgerProperties;
import com.finledger.dto.BudgetRequest;
import com.finledger.dto.BudgetResponse;
import com.finledger.engine.Amounts;
import com.finledger.engine.BudgetProgress;
import com.finledger.engine.BudgetProgressCalculator;
import com.finledger.engine.PeriodWindow;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.NotFoundException;
import com.finledger.model.AccountTransaction;
import com.finledger.model.Budget;
import com.finledger.model.Category;
import com.finledger.repository.AccountTransactionRepository;
import com.finledger.repository.BudgetRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class BudgetService {
  private static final String OVERALL_BUDGET_NAME = "Overall";

  private final BudgetRepository budgetRepository;
  private final AccountTransactionRepository transactionRepository;
  private final CategoryService categoryService;
  private final BudgetProgressCalculator progressCalculator;
  private final LedgerProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public BudgetService(BudgetRepository budgetRepository,
                       AccountTransactionRepository transactionRepository,
                       CategoryService categoryService,
                       BudgetProgressCalculator progressCalculator,
                       LedgerProperties properties,
                       ApplicationEventPublisher eventPublisher,
                       Clock clock) {
    this.budgetRepository = budgetRepository;
    this.transactionRepository = transactionRepository;
    this.categoryService = categoryService;
    this.progressCalculator = progressCalculator;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public List<BudgetResponse> listBudgets(UUID userId) {
    return budgetRepository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId).stream()
        .map(this::toResponse)
        .toList();
  }

  public BudgetResponse createBudget(UUID userId, BudgetRequest request) {
    if (request.getPeriod() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "period is required");
    }
    Budget budget = new Budget();
    budget.setUserId(userId);
    budget.setAmount(Amounts.requirePositive(request.getAmount(), "amount"));
    budget.setPeriod(request.getPeriod());
    budget.setStartDate(request.getStartDate() == null ? LocalDate.now(clock) : request.getStartDate());
    budget.setAlertThreshold(request.getAlertThreshold() == null
        ? properties.defaultAlertThreshold()
        : request.getAlertThreshold());

    String categoryName = null;
    if (request.getCategoryId() != null) {
      Category category = categoryService.requireCategory(userId, request.getCategoryId());
      budget.setCategoryId(category.getId());
      categoryName = category.getName();
    }
    String name = trimToNull(request.getName());
    budget.setName(name != null ? name : categoryName != null ? categoryName : OVERALL_BUDGET_NAME);

    Budget saved = budgetRepository.save(budget);
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved);
  }

  public BudgetResponse updateBudget(UUID userId, UUID budgetId, BudgetRequest request) {
    Budget budget = requireBudget(userId, budgetId);
    if (request.getName() != null) {
      String name = trimToNull(request.getName());
      if (name == null) {
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name must not be blank");
      }
      budget.setName(name);
    }
    if (Boolean.TRUE.equals(request.getOverall())) {
      budget.setCategoryId(null);
    } else if (request.getCategoryId() != null) {
      budget.setCategoryId(categoryService.requireCategory(userId, request.getCategoryId()).getId());
    }
    if (request.getAmount() != null) {
      budget.setAmount(Amounts.requirePositive(request.getAmount(), "amount"));
    }
    if (request.getPeriod() != null) {
      budget.setPeriod(request.getPeriod());
    }
    if (request.getStartDate() != null) {
      budget.setStartDate(request.getStartDate());
    }
    if (request.getAlertThreshold() != null) {
      budget.setAlertThreshold(request.getAlertThreshold());
    }
    if (request.getActive() != null) {
      budget.setActive(request.getActive());
    }
    Budget saved = budgetRepository.save(budget);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  public void deleteBudget(UUID userId, UUID budgetId) {
    Budget budget = requireBudget(userId, budgetId);
    budgetRepository.delete(budget);
    publish(userId, budgetId, ChangeKind.DELETED);
  }

  public List<BudgetProgress> listProgress(UUID userId) {
    ZonedDateTime now = ZonedDateTime.now(clock);
    return budgetRepository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId).stream()
        .map(budget -> progress(budget, now))
        .toList();
  }

  public BudgetProgress getProgress(UUID userId, UUID budgetId) {
    return progress(requireBudget(userId, budgetId), ZonedDateTime.now(clock));
  }

  private BudgetProgress progress(Budget budget, ZonedDateTime now) {
    PeriodWindow window = progressCalculator.currentWindow(budget, now);
    List<AccountTransaction> transactions =
        transactionRepository.findUserTransactionsInRange(budget.getUserId(), window.start(), window.end());
    return progressCalculator.calculate(budget, transactions, now);
  }

  private Budget requireBudget(UUID userId, UUID budgetId) {
    Budget budget = budgetRepository.findById(budgetId)
        .orElseThrow(() -> new NotFoundException("Budget not found"));
    if (!budget.getUserId().equals(userId)) {
      throw new NotFoundException("Budget not found");
    }
    return budget;
  }

  private void publish(UUID userId, UUID budgetId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.BUDGETS, budgetId, kind));
  }

  private String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  private BudgetResponse toResponse(Budget budget) {
    return new BudgetResponse(
        budget.getId(),
        budget.getName(),
        budget.getCategoryId(),
        budget.getAmount(),
        budget.getPeriod(),
        budget.getStartDate(),
        budget.getAlertThreshold(),
        budget.isActive(),
        budget.getCreatedAt(),
        budget.getUpdatedAt()
    );
  }
}
