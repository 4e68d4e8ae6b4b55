package com.finledger.controller;

import com.finledger.dto.RecurringRequest;
import com.finledger.dto.RecurringResponse;
import com.finledger.engine.SweepResult;
import com.finledger.service.CurrentUserService;
import com.finledger.service.RecurringTransactionService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger/recurring")
public class RecurringTransactionController {
  private final RecurringTransactionService recurringService;
  private final CurrentUserService currentUserService;

  public RecurringTransactionController(RecurringTransactionService recurringService,
                                        CurrentUserService currentUserService) {
    this.recurringService = recurringService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<RecurringResponse> listRecurring(@RequestParam(defaultValue = "false") boolean includeInactive) {
    UUID userId = currentUserService.requireUserId();
    return recurringService.listRecurring(userId, includeInactive);
  }

  @GetMapping("/upcoming")
  public List<RecurringResponse> listUpcoming() {
    UUID userId = currentUserService.requireUserId();
    return recurringService.listUpcoming(userId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public RecurringResponse createRecurring(@Valid @RequestBody RecurringRequest request) {
    UUID userId = currentUserService.requireUserId();
    return recurringService.createRecurring(userId, request);
  }

  @PatchMapping("/{recurringId}")
  public RecurringResponse updateRecurring(@PathVariable UUID recurringId,
                                           @Valid @RequestBody RecurringRequest request) {
    UUID userId = currentUserService.requireUserId();
    return recurringService.updateRecurring(userId, recurringId, request);
  }

  @DeleteMapping("/{recurringId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteRecurring(@PathVariable UUID recurringId) {
    UUID userId = currentUserService.requireUserId();
    recurringService.deleteRecurring(userId, recurringId);
  }

  @PostMapping("/sweep")
  public SweepResult sweep() {
    UUID userId = currentUserService.requireUserId();
    return recurringService.sweep(userId);
  }
}
