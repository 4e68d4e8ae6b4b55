package com.finledger.repository;

import com.finledger.model.Category;
import com.finledger.model.CategoryType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CategoryRepository extends JpaRepository<Category, UUID> {
  List<Category> findByUserIdOrderByTypeAscNameAsc(UUID userId);

  List<Category> findByUserIdAndTypeOrderByNameAsc(UUID userId, CategoryType type);

  Optional<Category> findByUserIdAndTypeAndNameIgnoreCase(UUID userId, CategoryType type, String name);

  boolean existsByUserId(UUID userId);
}
