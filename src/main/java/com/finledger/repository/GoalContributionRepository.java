package com.finledger.repository;

import com.finledger.model.GoalContribution;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GoalContributionRepository extends JpaRepository<GoalContribution, UUID> {
  @Query("select c from GoalContribution c where c.goal.id = :goalId order by c.createdAt desc")
  List<GoalContribution> findGoalContributions(@Param("goalId") UUID goalId);

  @Modifying
  @Query("delete from GoalContribution c where c.goal.id = :goalId")
  int deleteByGoalId(@Param("goalId") UUID goalId);
}
