package com.finledger.dto;

import com.finledger.model.CategoryType;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CategoryRequest {
  @Size(max = 80)
  private String name;

  private CategoryType type;
  private String icon;
  private String color;
}
