package com.finledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "savings_goals")
@Getter
@Setter
public class SavingsGoal {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String name;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal targetAmount;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal initialAmount;

  /** initialAmount plus every contribution; only contributions write it after creation. */
  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal currentAmount;

  @Column
  private LocalDate deadline;

  @Column
  private String icon;

  @Column
  private String color;

  @Column(nullable = false)
  private boolean completed;

  @Column
  private Instant completedAt;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (initialAmount == null) {
      initialAmount = BigDecimal.ZERO;
    }
    if (currentAmount == null) {
      currentAmount = initialAmount;
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
