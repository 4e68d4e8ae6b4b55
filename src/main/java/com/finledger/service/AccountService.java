package com.finledger.service;

import com.finledger.dto.AccountResponse;
import com.finledger.dto.CreateAccountRequest;
import com.finledger.dto.UpdateAccountRequest;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.NotFoundException;
import com.finledger.model.Account;
import com.finledger.repository.AccountRepository;
import com.finledger.repository.AccountTransactionRepository;
import com.finledger.repository.RecurringTransactionRepository;
import java.math.BigDecimal;
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
public class AccountService {
  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final AccountRepository accountRepository;
  private final AccountTransactionRepository transactionRepository;
  private final RecurringTransactionRepository recurringRepository;
  private final ApplicationEventPublisher eventPublisher;

  public AccountService(AccountRepository accountRepository,
                        AccountTransactionRepository transactionRepository,
                        RecurringTransactionRepository recurringRepository,
                        ApplicationEventPublisher eventPublisher) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.recurringRepository = recurringRepository;
    this.eventPublisher = eventPublisher;
  }

  public List<AccountResponse> listAccounts(UUID userId, boolean includeInactive) {
    List<Account> accounts = includeInactive
        ? accountRepository.findByUserIdOrderByCreatedAtAsc(userId)
        : accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId);
    return accounts.stream().map(this::toResponse).toList();
  }

  public AccountResponse getAccount(UUID userId, UUID accountId) {
    return toResponse(requireAccount(userId, accountId));
  }

  public AccountResponse createAccount(UUID userId, CreateAccountRequest request) {
    Account account = new Account();
    account.setUserId(userId);
    account.setName(requireText(request.getName(), "name"));
    account.setType(request.getType());
    BigDecimal opening = request.getOpeningBalance() == null ? BigDecimal.ZERO : request.getOpeningBalance();
    account.setOpeningBalance(opening);
    account.setBalance(opening);
    account.setColor(request.getColor());
    account.setIcon(request.getIcon());
    Account saved = accountRepository.save(account);
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved);
  }

  public AccountResponse updateAccount(UUID userId, UUID accountId, UpdateAccountRequest request) {
    Account account = requireAccount(userId, accountId);
    if (request.getName() != null) {
      account.setName(requireText(request.getName(), "name"));
    }
    if (request.getType() != null) {
      account.setType(request.getType());
    }
    if (request.getColor() != null) {
      account.setColor(request.getColor());
    }
    if (request.getIcon() != null) {
      account.setIcon(request.getIcon());
    }
    if (request.getActive() != null) {
      account.setActive(request.getActive());
    }
    Account saved = accountRepository.save(account);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  /** Removes the account together with its transactions and recurring schedules. */
  @Transactional
  public void deleteAccount(UUID userId, UUID accountId) {
    Account account = requireAccount(userId, accountId);
    int transactions = transactionRepository.deleteByAccountId(account.getId());
    int recurring = recurringRepository.deleteByAccountId(account.getId());
    accountRepository.delete(account);
    log.info("Deleted account {} with {} transaction(s) and {} recurring item(s)", accountId, transactions, recurring);
    publish(userId, accountId, ChangeKind.DELETED);
  }

  public Account requireAccount(UUID userId, UUID accountId) {
    if (accountId == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "accountId is required");
    }
    Account account = accountRepository.findById(accountId)
        .orElseThrow(() -> new NotFoundException("Account not found"));
    if (!account.getUserId().equals(userId)) {
      throw new NotFoundException("Account not found");
    }
    return account;
  }

  AccountResponse toResponse(Account account) {
    return new AccountResponse(
        account.getId(),
        account.getName(),
        account.getType(),
        account.getBalance(),
        account.getOpeningBalance(),
        account.getColor(),
        account.getIcon(),
        account.isActive(),
        account.getCreatedAt(),
        account.getUpdatedAt()
    );
  }

  private void publish(UUID userId, UUID accountId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.ACCOUNTS, accountId, kind));
  }

  private String requireText(String value, String field) {
    if (value == null || value.trim().isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
    }
    return value.trim();
  }
}
