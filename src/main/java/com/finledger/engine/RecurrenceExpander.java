package com.finledger.engine;

import com.finledger.model.AccountTransaction;
import com.finledger.model.RecurringTransaction;
import com.finledger.repository.AccountTransactionRepository;
import com.finledger.repository.RecurringTransactionRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Turns due recurring items into concrete transactions, backfilling every occurrence missed since
 * the last sweep. Each occurrence commits on its own together with the advanced {@code nextDate},
 * so an interrupted sweep resumes exactly where it stopped.
 */
@Component
public class RecurrenceExpander {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceExpander.class);
  static final String NOTES_PREFIX = "Auto-generated from recurring: ";

  private final AccountTransactionRepository transactionRepository;
  private final RecurringTransactionRepository recurringRepository;
  private final BalanceLedger balanceLedger;
  private final TransactionTemplate transactionTemplate;

  public RecurrenceExpander(
      AccountTransactionRepository transactionRepository,
      RecurringTransactionRepository recurringRepository,
      BalanceLedger balanceLedger,
      PlatformTransactionManager transactionManager) {
    this.transactionRepository = transactionRepository;
    this.recurringRepository = recurringRepository;
    this.balanceLedger = balanceLedger;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public SweepResult sweep(List<RecurringTransaction> items, LocalDate today) {
    int generated = 0;
    List<UUID> failed = new ArrayList<>();
    for (RecurringTransaction item : items) {
      if (!item.isActive()) {
        continue;
      }
      ItemExpansion expansion = expand(item, today);
      generated += expansion.generated();
      if (expansion.failed()) {
        failed.add(item.getId());
      }
    }
    return new SweepResult(generated, List.copyOf(failed));
  }

  ItemExpansion expand(RecurringTransaction item, LocalDate today) {
    if (item.getEndDate() != null && item.getEndDate().isBefore(today)) {
      item.setActive(false);
      if (!persist(item)) {
        item.setActive(true);
        return new ItemExpansion(0, true);
      }
      log.info("Recurring {} ended on {}, deactivated", item.getId(), item.getEndDate());
      return new ItemExpansion(0, false);
    }

    int generated = 0;
    while (item.isActive() && !item.getNextDate().isAfter(today)) {
      LocalDate occurrence = item.getNextDate();
      LocalDate previousGenerated = item.getLastGeneratedDate();
      try {
        transactionTemplate.executeWithoutResult(status -> materialize(item, occurrence));
        generated++;
      } catch (RuntimeException ex) {
        item.setNextDate(occurrence);
        item.setLastGeneratedDate(previousGenerated);
        item.setActive(true);
        log.warn("Recurring {} stopped at occurrence {} after {} generated: {}",
            item.getId(), occurrence, generated, ex.getMessage());
        return new ItemExpansion(generated, true);
      }
    }

    if (generated > 0) {
      LocalDate previousGenerated = item.getLastGeneratedDate();
      item.setLastGeneratedDate(today);
      if (!persist(item)) {
        item.setLastGeneratedDate(previousGenerated);
      }
      log.info("Recurring {} generated {} transaction(s), next due {}", item.getId(), generated, item.getNextDate());
    }
    return new ItemExpansion(generated, false);
  }

  private void materialize(RecurringTransaction item, LocalDate occurrence) {
    AccountTransaction tx = new AccountTransaction();
    tx.setUserId(item.getUserId());
    tx.setAccount(item.getAccount());
    tx.setType(item.getType());
    tx.setAmount(item.getAmount());
    tx.setDescription(item.getDescription());
    tx.setCategoryId(item.getCategoryId());
    tx.setBookingDate(occurrence);
    tx.setNotes(NOTES_PREFIX + item.getDescription());
    tx.setRecurringId(item.getId());
    transactionRepository.save(tx);

    LocalDate next = item.getFrequency().next(occurrence);
    item.setNextDate(next);
    item.setLastGeneratedDate(occurrence);
    if (item.getEndDate() != null && next.isAfter(item.getEndDate())) {
      item.setActive(false);
    }
    recurringRepository.save(item);

    balanceLedger.recordCreate(item.getAccount().getId(), LedgerEntry.of(tx));
  }

  private boolean persist(RecurringTransaction item) {
    try {
      transactionTemplate.executeWithoutResult(status -> recurringRepository.save(item));
      return true;
    } catch (RuntimeException ex) {
      log.warn("Failed to update recurring {}: {}", item.getId(), ex.getMessage());
      return false;
    }
  }

  record ItemExpansion(int generated, boolean failed) {}
}
