package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.model.ApprovalDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ApprovalDecisionRepository extends JpaRepository<ApprovalDecision, UUID> {
    List<ApprovalDecision> findByClaim_IdOrderByDecidedAtAsc(UUID claimId);

    boolean existsByActor_Id(UUID actorId);
}
