package com.finledger.service;

import com.finledger.config.LedgerProperties;
import com.finledger.dto.RecurringRequest;
import com.finledger.dto.RecurringResponse;
import com.finledger.engine.Amounts;
import com.finledger.engine.RecurrenceExpander;
import com.finledger.engine.SweepResult;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.NotFoundException;
import com.finledger.model.Account;
import com.finledger.model.RecurringTransaction;
import com.finledger.repository.RecurringTransactionRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class RecurringTransactionService {
  private static final Logger log = LoggerFactory.getLogger(RecurringTransactionService.class);

  private final RecurringTransactionRepository recurringRepository;
  private final AccountService accountService;
  private final CategoryService categoryService;
  private final RecurrenceExpander expander;
  private final LedgerProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final Set<UUID> sweepsInProgress = ConcurrentHashMap.newKeySet();

  public RecurringTransactionService(RecurringTransactionRepository recurringRepository,
                                     AccountService accountService,
                                     CategoryService categoryService,
                                     RecurrenceExpander expander,
                                     LedgerProperties properties,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock) {
    this.recurringRepository = recurringRepository;
    this.accountService = accountService;
    this.categoryService = categoryService;
    this.expander = expander;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public List<RecurringResponse> listRecurring(UUID userId, boolean includeInactive) {
    List<RecurringTransaction> items = includeInactive
        ? recurringRepository.findByUserIdOrderByNextDateAsc(userId)
        : recurringRepository.findByUserIdAndActiveTrueOrderByNextDateAsc(userId);
    return items.stream().map(this::toResponse).toList();
  }

  /** Active items due within the configured look-ahead window, overdue ones included. */
  public List<RecurringResponse> listUpcoming(UUID userId) {
    LocalDate until = LocalDate.now(clock).plusDays(properties.upcomingWindowDays());
    return recurringRepository.findUpcoming(userId, until).stream().map(this::toResponse).toList();
  }

  public RecurringResponse createRecurring(UUID userId, RecurringRequest request) {
    Account account = accountService.requireAccount(userId, request.getAccountId());
    if (request.getType() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "type is required");
    }
    if (request.getFrequency() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "frequency is required");
    }
    String description = requireText(request.getDescription(), "description");
    LocalDate startDate = request.getStartDate() == null ? LocalDate.now(clock) : request.getStartDate();
    if (request.getEndDate() != null && request.getEndDate().isBefore(startDate)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate must not be before startDate");
    }

    RecurringTransaction item = new RecurringTransaction();
    item.setUserId(userId);
    item.setAccount(account);
    item.setType(request.getType());
    item.setAmount(Amounts.requirePositive(request.getAmount(), "amount"));
    item.setDescription(description);
    if (request.getCategoryId() != null) {
      item.setCategoryId(categoryService.requireCategory(userId, request.getCategoryId()).getId());
    }
    item.setFrequency(request.getFrequency());
    item.setStartDate(startDate);
    item.setNextDate(request.getFrequency().next(startDate));
    item.setEndDate(request.getEndDate());
    RecurringTransaction saved = recurringRepository.save(item);
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved);
  }

  /** Changes apply to future occurrences; already generated transactions are left as they are. */
  public RecurringResponse updateRecurring(UUID userId, UUID recurringId, RecurringRequest request) {
    RecurringTransaction item = requireRecurring(userId, recurringId);
    if (request.getAccountId() != null && !request.getAccountId().equals(item.getAccount().getId())) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Recurring transactions cannot move between accounts");
    }
    if (request.getType() != null) {
      item.setType(request.getType());
    }
    if (request.getAmount() != null) {
      item.setAmount(Amounts.requirePositive(request.getAmount(), "amount"));
    }
    if (request.getDescription() != null) {
      item.setDescription(requireText(request.getDescription(), "description"));
    }
    if (request.getCategoryId() != null) {
      item.setCategoryId(categoryService.requireCategory(userId, request.getCategoryId()).getId());
    }
    if (request.getFrequency() != null) {
      item.setFrequency(request.getFrequency());
    }
    if (Boolean.TRUE.equals(request.getClearEndDate())) {
      item.setEndDate(null);
    } else if (request.getEndDate() != null) {
      if (request.getEndDate().isBefore(item.getStartDate())) {
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate must not be before startDate");
      }
      item.setEndDate(request.getEndDate());
    }
    if (request.getActive() != null) {
      item.setActive(request.getActive());
    }
    RecurringTransaction saved = recurringRepository.save(item);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  public void deleteRecurring(UUID userId, UUID recurringId) {
    RecurringTransaction item = requireRecurring(userId, recurringId);
    recurringRepository.delete(item);
    publish(userId, recurringId, ChangeKind.DELETED);
  }

  /**
   * Materializes every due occurrence of the owner's active recurring items. Not transactional on
   * purpose: the expander commits each occurrence separately.
   */
  public SweepResult sweep(UUID userId) {
    if (!sweepsInProgress.add(userId)) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "A recurring sweep is already running");
    }
    try {
      LocalDate today = LocalDate.now(clock);
      List<RecurringTransaction> items = recurringRepository.findByUserIdAndActiveTrueOrderByNextDateAsc(userId);
      if (items.isEmpty()) {
        return SweepResult.empty();
      }
      SweepResult result = expander.sweep(items, today);
      if (result.generated() > 0) {
        log.info("Recurring sweep for {} generated {} transaction(s)", userId, result.generated());
        eventPublisher.publishEvent(
            new LedgerChangedEvent(userId, LedgerCollection.TRANSACTIONS, null, ChangeKind.CREATED));
        eventPublisher.publishEvent(
            new LedgerChangedEvent(userId, LedgerCollection.RECURRING, null, ChangeKind.UPDATED));
      }
      if (!result.failedItemIds().isEmpty()) {
        log.warn("Recurring sweep for {} left {} item(s) unfinished: {}",
            userId, result.failedItemIds().size(), result.failedItemIds());
      }
      return result;
    } finally {
      sweepsInProgress.remove(userId);
    }
  }

  private RecurringTransaction requireRecurring(UUID userId, UUID recurringId) {
    RecurringTransaction item = recurringRepository.findById(recurringId)
        .orElseThrow(() -> new NotFoundException("Recurring transaction not found"));
    if (!item.getUserId().equals(userId)) {
      throw new NotFoundException("Recurring transaction not found");
    }
    return item;
  }

  private void publish(UUID userId, UUID recurringId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.RECURRING, recurringId, kind));
  }

  private String requireText(String value, String field) {
    if (value == null || value.trim().isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
    }
    return value.trim();
  }

  private RecurringResponse toResponse(RecurringTransaction item) {
    return new RecurringResponse(
        item.getId(),
        item.getAccount().getId(),
        item.getType(),
        item.getAmount(),
        item.getDescription(),
        item.getCategoryId(),
        item.getFrequency(),
        item.getStartDate(),
        item.getNextDate(),
        item.getEndDate(),
        item.isActive(),
        item.getLastGeneratedDate(),
        item.getCreatedAt(),
        item.getUpdatedAt()
    );
  }
}
