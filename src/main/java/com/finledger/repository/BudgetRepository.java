package com.finledger.repository;

import com.finledger.model.Budget;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BudgetRepository extends JpaRepository<Budget, UUID> {
  List<Budget> findByUserIdAndActiveTrueOrderByCreatedAtDesc(UUID userId);

  boolean existsByUserIdAndCategoryId(UUID userId, UUID categoryId);
}
