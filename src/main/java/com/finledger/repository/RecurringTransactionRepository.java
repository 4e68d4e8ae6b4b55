package com.finledger.repository;

import com.finledger.model.RecurringTransaction;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecurringTransactionRepository extends JpaRepository<RecurringTransaction, UUID> {
  List<RecurringTransaction> findByUserIdAndActiveTrueOrderByNextDateAsc(UUID userId);

  List<RecurringTransaction> findByUserIdOrderByNextDateAsc(UUID userId);

  @Query("select r from RecurringTransaction r " +
      "where r.userId = :userId and r.active = true and r.nextDate <= :until " +
      "order by r.nextDate asc")
  List<RecurringTransaction> findUpcoming(
      @Param("userId") UUID userId,
      @Param("until") LocalDate until);

  boolean existsByUserIdAndCategoryId(UUID userId, UUID categoryId);

  @Modifying
  @Query("delete from RecurringTransaction r where r.account.id = :accountId")
  int deleteByAccountId(@Param("accountId") UUID accountId);
}
