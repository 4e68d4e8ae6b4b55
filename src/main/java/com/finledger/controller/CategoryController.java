package com.finledger.controller;

import com.finledger.dto.CategoryRequest;
import com.finledger.dto.CategoryResponse;
import com.finledger.model.CategoryType;
import com.finledger.service.CategoryService;
import com.finledger.service.CurrentUserService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger/categories")
public class CategoryController {
  private final CategoryService categoryService;
  private final CurrentUserService currentUserService;

  public CategoryController(CategoryService categoryService, CurrentUserService currentUserService) {
    this.categoryService = categoryService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<CategoryResponse> list(@RequestParam(required = false) CategoryType type) {
    UUID userId = currentUserService.requireUserId();
    return categoryService.list(userId, type);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public CategoryResponse create(@Valid @RequestBody CategoryRequest request) {
    UUID userId = currentUserService.requireUserId();
    return categoryService.create(userId, request);
  }

  @PostMapping("/defaults")
  public List<CategoryResponse> seedDefaults() {
    UUID userId = currentUserService.requireUserId();
    return categoryService.seedDefaults(userId);
  }

  @PatchMapping("/{categoryId}")
  public CategoryResponse update(@PathVariable UUID categoryId, @Valid @RequestBody CategoryRequest request) {
    UUID userId = currentUserService.requireUserId();
    return categoryService.update(userId, categoryId, request);
  }

  @DeleteMapping("/{categoryId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID categoryId) {
    UUID userId = currentUserService.requireUserId();
    categoryService.delete(userId, categoryId);
  }
}
