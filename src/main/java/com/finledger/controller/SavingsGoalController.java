package com.finledger.controller;

import com.finledger.dto.ContributionRequest;
import com.finledger.dto.ContributionResponse;
import com.finledger.dto.SavingsGoalRequest;
import com.finledger.dto.SavingsGoalResponse;
import com.finledger.engine.GoalProgress;
import com.finledger.service.CurrentUserService;
import com.finledger.service.SavingsGoalService;
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
@RequestMapping("/api/ledger/goals")
public class SavingsGoalController {
  private final SavingsGoalService goalService;
  private final CurrentUserService currentUserService;

  public SavingsGoalController(SavingsGoalService goalService, CurrentUserService currentUserService) {
    this.goalService = goalService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<SavingsGoalResponse> listGoals() {
    UUID userId = currentUserService.requireUserId();
    return goalService.listGoals(userId);
  }

  @GetMapping("/progress")
  public List<GoalProgress> listProgress() {
    UUID userId = currentUserService.requireUserId();
    return goalService.listProgress(userId);
  }

  @GetMapping("/{goalId}")
  public SavingsGoalResponse getGoal(@PathVariable UUID goalId) {
    UUID userId = currentUserService.requireUserId();
    return goalService.getGoal(userId, goalId);
  }

  @GetMapping("/{goalId}/progress")
  public GoalProgress getProgress(@PathVariable UUID goalId) {
    UUID userId = currentUserService.requireUserId();
    return goalService.getProgress(userId, goalId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public SavingsGoalResponse createGoal(@Valid @RequestBody SavingsGoalRequest request) {
    UUID userId = currentUserService.requireUserId();
    return goalService.createGoal(userId, request);
  }

  @PatchMapping("/{goalId}")
  public SavingsGoalResponse updateGoal(@PathVariable UUID goalId, @Valid @RequestBody SavingsGoalRequest request) {
    UUID userId = currentUserService.requireUserId();
    return goalService.updateGoal(userId, goalId, request);
  }

  @DeleteMapping("/{goalId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteGoal(@PathVariable UUID goalId) {
    UUID userId = currentUserService.requireUserId();
    goalService.deleteGoal(userId, goalId);
  }

  @PostMapping("/{goalId}/contributions")
  public SavingsGoalResponse contribute(@PathVariable UUID goalId, @Valid @RequestBody ContributionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return goalService.contribute(userId, goalId, request);
  }

  @GetMapping("/{goalId}/contributions")
  public List<ContributionResponse> listContributions(@PathVariable UUID goalId) {
    UUID userId = currentUserService.requireUserId();
    return goalService.listContributions(userId, goalId);
  }
}
