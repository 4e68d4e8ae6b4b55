package com.finledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "goal_contributions")
@Getter
@Setter
public class GoalContribution {
  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "goal_id", updatable = false)
  private SavingsGoal goal;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column
  private String note;

  @Column(nullable = false)
  private LocalDate contributionDate;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
