package com.finledger.dto;

import com.finledger.model.CategoryType;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategoryResponse {
  private UUID id;
  private String name;
  private CategoryType type;
  private String icon;
  private String color;
  private boolean defaultCategory;
  private Instant createdAt;
  private Instant updatedAt;
}
