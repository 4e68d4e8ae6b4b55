package com.finledger.service;

import com.finledger.dto.CategoryRequest;
import com.finledger.dto.CategoryResponse;
import com.finledger.event.ChangeKind;
import com.finledger.event.LedgerChangedEvent;
import com.finledger.event.LedgerCollection;
import com.finledger.exception.NotFoundException;
import com.finledger.model.Category;
import com.finledger.model.CategoryType;
import com.finledger.repository.AccountTransactionRepository;
import com.finledger.repository.BudgetRepository;
import com.finledger.repository.CategoryRepository;
import com.finledger.repository.RecurringTransactionRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class CategoryService {
  record DefaultCategory(String name, String icon, String color) {}

  static final List<DefaultCategory> DEFAULT_EXPENSE_CATEGORIES = List.of(
      new DefaultCategory("Groceries", "local-grocery-store", "#4CAF50"),
      new DefaultCategory("Food & Dining", "restaurant", "#FF6B6B"),
      new DefaultCategory("Gas", "local-gas-station", "#FF9800"),
      new DefaultCategory("Transportation", "directions-car", "#4ECDC4"),
      new DefaultCategory("Housing", "home", "#45B7D1"),
      new DefaultCategory("Utilities", "flash-on", "#96CEB4"),
      new DefaultCategory("Entertainment", "movie", "#DDA0DD"),
      new DefaultCategory("Shopping", "shopping-bag", "#F7DC6F"),
      new DefaultCategory("Health", "favorite", "#FF69B4"),
      new DefaultCategory("Personal", "person", "#87CEEB"),
      new DefaultCategory("Education", "school", "#98D8C8"),
      new DefaultCategory("Subscriptions", "subscriptions", "#C9B1FF"),
      new DefaultCategory("Other", "more-horiz", "#BDC3C7")
  );

  static final List<DefaultCategory> DEFAULT_INCOME_CATEGORIES = List.of(
      new DefaultCategory("Salary", "work", "#2ECC71"),
      new DefaultCategory("Freelance", "laptop", "#3498DB"),
      new DefaultCategory("Investment", "trending-up", "#9B59B6"),
      new DefaultCategory("Gift", "card-giftcard", "#E74C3C"),
      new DefaultCategory("Refund", "replay", "#1ABC9C"),
      new DefaultCategory("Other", "more-horiz", "#95A5A6")
  );

  private final CategoryRepository categoryRepository;
  private final AccountTransactionRepository transactionRepository;
  private final BudgetRepository budgetRepository;
  private final RecurringTransactionRepository recurringRepository;
  private final ApplicationEventPublisher eventPublisher;

  public CategoryService(CategoryRepository categoryRepository,
                         AccountTransactionRepository transactionRepository,
                         BudgetRepository budgetRepository,
                         RecurringTransactionRepository recurringRepository,
                         ApplicationEventPublisher eventPublisher) {
    this.categoryRepository = categoryRepository;
    this.transactionRepository = transactionRepository;
    this.budgetRepository = budgetRepository;
    this.recurringRepository = recurringRepository;
    this.eventPublisher = eventPublisher;
  }

  public List<CategoryResponse> list(UUID userId, CategoryType type) {
    if (!categoryRepository.existsByUserId(userId)) {
      seedDefaults(userId);
    }
    List<Category> categories = type == null
        ? categoryRepository.findByUserIdOrderByTypeAscNameAsc(userId)
        : categoryRepository.findByUserIdAndTypeOrderByNameAsc(userId, type);
    return categories.stream().map(this::toResponse).toList();
  }

  /** Adds whichever default categories the owner is missing. Safe to call repeatedly. */
  public List<CategoryResponse> seedDefaults(UUID userId) {
    int created = seedType(userId, CategoryType.EXPENSE, DEFAULT_EXPENSE_CATEGORIES)
        + seedType(userId, CategoryType.INCOME, DEFAULT_INCOME_CATEGORIES);
    if (created > 0) {
      eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.CATEGORIES, null, ChangeKind.CREATED));
    }
    return categoryRepository.findByUserIdOrderByTypeAscNameAsc(userId).stream().map(this::toResponse).toList();
  }

  public CategoryResponse create(UUID userId, CategoryRequest request) {
    String name = normalizeName(request.getName());
    if (name == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Name is required");
    }
    if (request.getType() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Type is required");
    }
    categoryRepository.findByUserIdAndTypeAndNameIgnoreCase(userId, request.getType(), name)
        .ifPresent(existing -> {
          throw new ResponseStatusException(HttpStatus.CONFLICT, "Category already exists");
        });
    Category category = new Category();
    category.setUserId(userId);
    category.setName(name);
    category.setType(request.getType());
    category.setIcon(request.getIcon());
    category.setColor(request.getColor());
    Category saved = categoryRepository.save(category);
    publish(userId, saved.getId(), ChangeKind.CREATED);
    return toResponse(saved);
  }

  public CategoryResponse update(UUID userId, UUID categoryId, CategoryRequest request) {
    Category category = requireCategory(userId, categoryId);
    if (request.getName() != null) {
      String name = normalizeName(request.getName());
      if (name == null) {
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Name is required");
      }
      categoryRepository.findByUserIdAndTypeAndNameIgnoreCase(userId, category.getType(), name)
          .filter(existing -> !existing.getId().equals(categoryId))
          .ifPresent(existing -> {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Category already exists");
          });
      category.setName(name);
    }
    if (request.getIcon() != null) {
      category.setIcon(request.getIcon());
    }
    if (request.getColor() != null) {
      category.setColor(request.getColor());
    }
    Category saved = categoryRepository.save(category);
    publish(userId, saved.getId(), ChangeKind.UPDATED);
    return toResponse(saved);
  }

  public void delete(UUID userId, UUID categoryId) {
    Category category = requireCategory(userId, categoryId);
    if (category.isDefaultCategory()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Default categories cannot be deleted");
    }
    if (transactionRepository.existsByUserIdAndCategoryId(userId, categoryId)
        || budgetRepository.existsByUserIdAndCategoryId(userId, categoryId)
        || recurringRepository.existsByUserIdAndCategoryId(userId, categoryId)) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Category is in use");
    }
    categoryRepository.delete(category);
    publish(userId, categoryId, ChangeKind.DELETED);
  }

  public Category requireCategory(UUID userId, UUID categoryId) {
    Category category = categoryRepository.findById(categoryId)
        .orElseThrow(() -> new NotFoundException("Category not found"));
    if (!category.getUserId().equals(userId)) {
      throw new NotFoundException("Category not found");
    }
    return category;
  }

  private int seedType(UUID userId, CategoryType type, List<DefaultCategory> defaults) {
    int created = 0;
    for (DefaultCategory definition : defaults) {
      if (categoryRepository.findByUserIdAndTypeAndNameIgnoreCase(userId, type, definition.name()).isPresent()) {
        continue;
      }
      Category category = new Category();
      category.setUserId(userId);
      category.setName(definition.name());
      category.setType(type);
      category.setIcon(definition.icon());
      category.setColor(definition.color());
      category.setDefaultCategory(true);
      categoryRepository.save(category);
      created++;
    }
    return created;
  }

  private void publish(UUID userId, UUID categoryId, ChangeKind kind) {
    eventPublisher.publishEvent(new LedgerChangedEvent(userId, LedgerCollection.CATEGORIES, categoryId, kind));
  }

  private String normalizeName(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  private CategoryResponse toResponse(Category category) {
    return new CategoryResponse(
        category.getId(),
        category.getName(),
        category.getType(),
        category.getIcon(),
        category.getColor(),
        category.isDefaultCategory(),
        category.getCreatedAt(),
        category.getUpdatedAt()
    );
  }
}
