package com.finledger.controller;

import com.finledger.dto.BudgetRequest;
import com.finledger.dto.BudgetResponse;
import com.finledger.engine.BudgetProgress;
import com.finledger.service.BudgetService;
import com.finledger.service.CurrentUserService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger/budgets")
public class BudgetController {
  private final BudgetService budgetService;
  private final CurrentUserService currentUserService;

  public BudgetController(BudgetService budgetService, CurrentUserService currentUserService) {
    this.budgetService = budgetService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<BudgetResponse> listBudgets() {
    UUID userId = currentUserService.requireUserId();
    return budgetService.listBudgets(userId);
  }

  @GetMapping("/progress")
  public List<BudgetProgress> listProgress() {
    UUID userId = currentUserService.requireUserId();
    return budgetService.listProgress(userId);
  }

  @GetMapping("/{budgetId}/progress")
  public BudgetProgress getProgress(@PathVariable UUID budgetId) {
    UUID userId = currentUserService.requireUserId();
    return budgetService.getProgress(userId, budgetId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public BudgetResponse createBudget(@Valid @RequestBody BudgetRequest request) {
    UUID userId = currentUserService.requireUserId();
    return budgetService.createBudget(userId, request);
  }

  @PatchMapping("/{budgetId}")
  public BudgetResponse updateBudget(@PathVariable UUID budgetId, @Valid @RequestBody BudgetRequest request) {
    UUID userId = currentUserService.requireUserId();
    return budgetService.updateBudget(userId, budgetId, request);
  }

  @DeleteMapping("/{budgetId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteBudget(@PathVariable UUID budgetId) {
    UUID userId = currentUserService.requireUserId();
    budgetService.deleteBudget(userId, budgetId);
  }
}
