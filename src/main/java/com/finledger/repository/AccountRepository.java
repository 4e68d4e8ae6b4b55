package com.finledger.repository;

import com.finledger.model.Account;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {
  List<Account> findByUserIdOrderByCreatedAtAsc(UUID userId);

  List<Account> findByUserIdAndActiveTrueOrderByCreatedAtAsc(UUID userId);

  List<Account> findByActiveTrue();

  /**
   * Atomic increment of the stored balance. Returns the number of rows touched, zero when the
   * account no longer exists.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Account a set a.balance = a.balance + :delta, a.updatedAt = :updatedAt where a.id = :id")
  int adjustBalance(
      @Param("id") UUID id,
      @Param("delta") BigDecimal delta,
      @Param("updatedAt") Instant updatedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Account a set a.balance = :balance, a.updatedAt = :updatedAt where a.id = :id")
  int overwriteBalance(
      @Param("id") UUID id,
      @Param("balance") BigDecimal balance,
      @Param("updatedAt") Instant updatedAt);
}
