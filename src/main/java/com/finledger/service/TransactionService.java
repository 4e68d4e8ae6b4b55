package com.finledger.service;

import com.finledger.dto.CreateTransactionRequest;
import com.finledger.dto.TransactionResponse;
import com.finledger.dto.UpdateTransactionRequest;
import com.finledger.engine.Amounts;
import com.finledger.engine.BalanceLedger;
import com.finledger.engine.LedgerEntry;
import com.finledger.engine.ProjectedTransaction;
import com.finledger.engine.RunningBalanceProjector;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.NotFoundException;
import com.finledger.model.Account;
import com.finledger.model.AccountTransaction;
import com.finledger.repository.AccountTransactionRepository;
import com.finledger.repository.CategoryRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Transaction writes. Each one stores the record and then hands the balance change to the
 * {@link BalanceLedger} inside the same storage transaction.
 */
@Service
public class TransactionService {
  private final AccountTransactionRepository transactionRepository;
  private final CategoryRepository categoryRepository;
  private final AccountService accountService;
  private final BalanceLedger balanceLedger;
  private final RunningBalanceProjector projector;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TransactionService(AccountTransactionRepository transactionRepository,
                            CategoryRepository categoryRepository,
                            AccountService accountService,
                            BalanceLedger balanceLedger,
                            RunningBalanceProjector projector,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
    this.transactionRepository = transactionRepository;
    this.categoryRepository = categoryRepository;
    this.accountService = accountService;
    this.balanceLedger = balanceLedger;
    this.projector = projector;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public TransactionResponse createTransaction(UUID userId, CreateTransactionRequest request) {
    Account account = accountService.requireAccount(userId, request.getAccountId());
    if (request.getType() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "type is required");
    }
    BigDecimal amount = Amounts.requirePositive(request.getAmount(), "amount");
    requireCategory(userId, request.getCategoryId());

    AccountTransaction tx = new AccountTransaction();
    tx.setUserId(userId);
    tx.setAccount(account);
    tx.setType(request.getType());
    tx.setAmount(amount);
    tx.setDescription(trimToNull(request.getDescription()));
    tx.setCategoryId(request.getCategoryId());
    tx.setBookingDate(request.getDate() == null ? LocalDate.now(clock) : request.getDate());
    tx.setCleared(request.getCleared() == null || request.getCleared());
    tx.setNotes(trimToNull(request.getNotes()));
    AccountTransaction saved = transactionRepository.save(tx);

    balanceLedger.recordCreate(account.getId(), LedgerEntry.of(saved));
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved, null);
  }

  @Transactional
  public TransactionResponse updateTransaction(UUID userId, UUID transactionId, UpdateTransactionRequest request) {
    AccountTransaction tx = requireTransaction(userId, transactionId);
    UUID accountId = tx.getAccount().getId();
    if (request.getAccountId() != null && !request.getAccountId().equals(accountId)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Transactions cannot move between accounts");
    }
    LedgerEntry before = LedgerEntry.of(tx);

    if (request.getType() != null) {
      tx.setType(request.getType());
    }
    if (request.getAmount() != null) {
      tx.setAmount(Amounts.requirePositive(request.getAmount(), "amount"));
    }
    if (request.getDescription() != null) {
      tx.setDescription(trimToNull(request.getDescription()));
    }
    if (Boolean.TRUE.equals(request.getClearCategory())) {
      tx.setCategoryId(null);
    } else if (request.getCategoryId() != null) {
      requireCategory(userId, request.getCategoryId());
      tx.setCategoryId(request.getCategoryId());
    }
    if (request.getDate() != null) {
      tx.setBookingDate(request.getDate());
    }
    if (request.getCleared() != null) {
      tx.setCleared(request.getCleared());
    }
    if (request.getReconciled() != null) {
      tx.setReconciled(request.getReconciled());
    }
    if (request.getNotes() != null) {
      tx.setNotes(trimToNull(request.getNotes()));
    }
    AccountTransaction saved = transactionRepository.save(tx);

    balanceLedger.recordEdit(accountId, before, LedgerEntry.of(saved));
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved, null);
  }

  @Transactional
  public void deleteTransaction(UUID userId, UUID transactionId) {
    AccountTransaction tx = requireTransaction(userId, transactionId);
    LedgerEntry entry = LedgerEntry.of(tx);
    transactionRepository.delete(tx);
    balanceLedger.recordDelete(entry.accountId(), entry);
    publish(userId, transactionId, ChangeKind.DELETED);
  }

  public TransactionResponse getTransaction(UUID userId, UUID transactionId) {
    return toResponse(requireTransaction(userId, transactionId), null);
  }

  /** Newest first, each row carrying the balance right after it. */
  public List<TransactionResponse> listAccountTransactions(UUID userId, UUID accountId) {
    Account account = accountService.requireAccount(userId, accountId);
    List<AccountTransaction> transactions = transactionRepository.findAccountTransactions(account.getId());
    return projector.project(account.getBalance(), transactions).stream()
        .map(this::toResponse)
        .toList();
  }

  public List<TransactionResponse> listTransactions(UUID userId, LocalDate from, LocalDate to) {
    LocalDate end = to == null ? LocalDate.now(clock) : to;
    LocalDate start = from == null ? end.withDayOfMonth(1) : from;
    if (start.isAfter(end)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "from must not be after to");
    }
    return transactionRepository.findUserTransactionsInRange(userId, start, end).stream()
        .map(tx -> toResponse(tx, null))
        .toList();
  }

  private AccountTransaction requireTransaction(UUID userId, UUID transactionId) {
    AccountTransaction tx = transactionRepository.findById(transactionId)
        .orElseThrow(() -> new NotFoundException("Transaction not found"));
    if (!tx.getUserId().equals(userId)) {
      throw new NotFoundException("Transaction not found");
    }
    return tx;
  }

  private void requireCategory(UUID userId, UUID categoryId) {
    if (categoryId == null) {
      return;
    }
    boolean owned = categoryRepository.findById(categoryId)
        .map(category -> category.getUserId().equals(userId))
        .orElse(false);
    if (!owned) {
      throw new NotFoundException("Category not found");
    }
  }

  private void publish(UUID userId, UUID transactionId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.TRANSACTIONS, transactionId, kind));
  }

  private TransactionResponse toResponse(ProjectedTransaction projected) {
    return toResponse(projected.transaction(), projected.runningBalance());
  }

  private TransactionResponse toResponse(AccountTransaction tx, BigDecimal runningBalance) {
    return new TransactionResponse(
        tx.getId(),
        tx.getAccount().getId(),
        tx.getType(),
        tx.getAmount(),
        tx.getDescription(),
        tx.getCategoryId(),
        tx.getBookingDate(),
        tx.isCleared(),
        tx.isReconciled(),
        tx.getNotes(),
        tx.getRecurringId(),
        runningBalance,
        tx.getCreatedAt(),
        tx.getUpdatedAt()
    );
  }

  private String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    return cleaned.isEmpty() ? null : cleaned;
  }
}
