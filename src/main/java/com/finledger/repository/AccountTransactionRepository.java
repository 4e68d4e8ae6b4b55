package com.finledger.repository;

import com.finledger.model.AccountTransaction;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountTransactionRepository extends JpaRepository<AccountTransaction, UUID> {
  @Query("select t from AccountTransaction t " +
      "where t.account.id = :accountId " +
      "order by t.bookingDate desc, t.createdAt desc")
  List<AccountTransaction> findAccountTransactions(@Param("accountId") UUID accountId);

  @Query("select t from AccountTransaction t " +
      "where t.userId = :userId " +
      "and t.bookingDate >= :from and t.bookingDate <= :to " +
      "order by t.bookingDate desc, t.createdAt desc")
  List<AccountTransaction> findUserTransactionsInRange(
      @Param("userId") UUID userId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  List<AccountTransaction> findByRecurringId(UUID recurringId);

  boolean existsByUserIdAndCategoryId(UUID userId, UUID categoryId);

  @Modifying
  @Query("delete from AccountTransaction t where t.account.id = :accountId")
  int deleteByAccountId(@Param("accountId") UUID accountId);
}
