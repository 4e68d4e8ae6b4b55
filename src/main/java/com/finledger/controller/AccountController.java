package com.finledger.controller;

import com.finledger.dto.AccountResponse;
import com.finledger.dto.CreateAccountRequest;
import com.finledger.dto.ReconciliationResponse;
import com.finledger.dto.TransactionResponse;
import com.finledger.dto.UpdateAccountRequest;
import com.finledger.service.AccountService;
import com.finledger.service.CurrentUserService;
import com.finledger.service.ReconciliationService;
import com.finledger.service.TransactionService;
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
@RequestMapping("/api/ledger/accounts")
public class AccountController {
  private final AccountService accountService;
  private final TransactionService transactionService;
  private final ReconciliationService reconciliationService;
  private final CurrentUserService currentUserService;

  public AccountController(AccountService accountService,
                          TransactionService transactionService,
                          ReconciliationService reconciliationService,
                          CurrentUserService currentUserService) {
    this.accountService = accountService;
    this.transactionService = transactionService;
    this.reconciliationService = reconciliationService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<AccountResponse> listAccounts(@RequestParam(defaultValue = "false") boolean includeInactive) {
    UUID userId = currentUserService.requireUserId();
    return accountService.listAccounts(userId, includeInactive);
  }

  @GetMapping("/{accountId}")
  public AccountResponse getAccount(@PathVariable UUID accountId) {
    UUID userId = currentUserService.requireUserId();
    return accountService.getAccount(userId, accountId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public AccountResponse createAccount(@Valid @RequestBody CreateAccountRequest request) {
    UUID userId = currentUserService.requireUserId();
    return accountService.createAccount(userId, request);
  }

  @PatchMapping("/{accountId}")
  public AccountResponse updateAccount(@PathVariable UUID accountId, @RequestBody UpdateAccountRequest request) {
    UUID userId = currentUserService.requireUserId();
    return accountService.updateAccount(userId, accountId, request);
  }

  @DeleteMapping("/{accountId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteAccount(@PathVariable UUID accountId) {
    UUID userId = currentUserService.requireUserId();
    accountService.deleteAccount(userId, accountId);
  }

  @GetMapping("/{accountId}/transactions")
  public List<TransactionResponse> listAccountTransactions(@PathVariable UUID accountId) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.listAccountTransactions(userId, accountId);
  }

  @PostMapping("/{accountId}/reconcile")
  public ReconciliationResponse reconcile(@PathVariable UUID accountId,
                                          @RequestParam(defaultValue = "false") boolean strict) {
    UUID userId = currentUserService.requireUserId();
    return reconciliationService.reconcile(userId, accountId, strict);
  }
}
