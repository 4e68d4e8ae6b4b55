package com.finledger.controller;

import com.finledger.dto.CreateTransactionRequest;
import com.finledger.dto.TransactionResponse;
import com.finledger.dto.UpdateTransactionRequest;
import com.finledger.service.CurrentUserService;
import com.finledger.service.TransactionService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
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
@RequestMapping("/api/ledger/transactions")
public class TransactionController {
  private final TransactionService transactionService;
  private final CurrentUserService currentUserService;

  public TransactionController(TransactionService transactionService, CurrentUserService currentUserService) {
    this.transactionService = transactionService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<TransactionResponse> listTransactions(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.listTransactions(userId, from, to);
  }

  @GetMapping("/{transactionId}")
  public TransactionResponse getTransaction(@PathVariable UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.getTransaction(userId, transactionId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public TransactionResponse createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.createTransaction(userId, request);
  }

  @PatchMapping("/{transactionId}")
  public TransactionResponse updateTransaction(@PathVariable UUID transactionId,
                                               @Valid @RequestBody UpdateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.updateTransaction(userId, transactionId, request);
  }

  @DeleteMapping("/{transactionId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteTransaction(@PathVariable UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    transactionService.deleteTransaction(userId, transactionId);
  }
}
