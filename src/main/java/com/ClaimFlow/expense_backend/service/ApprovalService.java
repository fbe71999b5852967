package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.DecisionOutcome;
import com.ClaimFlow.expense_backend.enums.Permission;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.event.ClaimStatusChangedEvent;
import com.ClaimFlow.expense_backend.exception.ForbiddenException;
import com.ClaimFlow.expense_backend.exception.InvalidStateException;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.SelfApprovalException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.ApprovalDecision;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalService {

    private final ExpenseClaimRepository expenseClaimRepository;
    private final ApprovalDecisionRepository approvalDecisionRepository;
    private final ApprovalStateMachine stateMachine;
    private final AuditService auditService;
    private final ExpenseClaimMapper claimMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PaginatedResponse<ExpenseClaimResponse> getPendingApprovals(User reviewer, int page, int limit) {
        Set<ClaimStatus> statuses = stateMachine.statusesAwaiting(reviewer.getRole());
        if (statuses.isEmpty() || !reviewer.hasPermission(Permission.APPROVE_EXPENSE)) {
            throw new ForbiddenException("Your role does not review expense claims");
        }

        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("submittedAt").ascending());
        Page<ExpenseClaim> claims = expenseClaimRepository.findByStatusInAndOwner_IdNot(statuses, reviewer.getId(), pageable);

        return PaginatedResponse.from(claims, claim -> claimMapper.toResponse(claim, reviewer));
    }

    @Transactional
    public ExpenseClaimResponse approve(User reviewer, UUID claimId, String comments) {
        return decide(reviewer, claimId, DecisionOutcome.APPROVE, comments);
    }

    @Transactional
    public ExpenseClaimResponse reject(User reviewer, UUID claimId, String comments) {
        return decide(reviewer, claimId, DecisionOutcome.REJECT, comments);
    }

    /**
     * Applies one reviewer decision. Refusals are checked in a fixed order (terminal claim,
     * own claim, wrong stage or role, missing reject comment) and each refusal is audited before
     * it is thrown. Callers of any role reach this method; the web layer does not filter them.
     */
    private ExpenseClaimResponse decide(User reviewer, UUID claimId, DecisionOutcome outcome, String comments) {
        ExpenseClaim claim = expenseClaimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", claimId));
        AuditAction action = outcome == DecisionOutcome.APPROVE ? AuditAction.CLAIM_APPROVED : AuditAction.CLAIM_REJECTED;
        ClaimStatus current = claim.getStatus();

        if (current.isTerminal()) {
            auditService.logDenied(reviewer, action, claim, "Claim already " + current.getValue());
            throw new InvalidStateException(
                    String.format("Claim %s is already %s", claim.getExpenseNumber(), current.getValue()), current);
        }

        if (claim.isOwnedBy(reviewer.getId())) {
            auditService.logDenied(reviewer, action, claim, "Reviewer is the claim owner");
            throw new SelfApprovalException(claim.getExpenseNumber());
        }

        Optional<ClaimStatus> next = stateMachine.next(current, reviewer.getRole(), outcome);
        if (next.isEmpty() || !reviewer.hasPermission(Permission.APPROVE_EXPENSE)) {
            String stageRole = stateMachine.stageRole(current).map(Role::getValue).orElse("nobody");
            auditService.logDenied(reviewer, action, claim,
                    String.format("Role %s cannot act on a claim awaiting %s", reviewer.getRole().getValue(), stageRole));
            throw new ForbiddenException(String.format("Claim %s is awaiting %s review",
                    claim.getExpenseNumber(), stageRole));
        }

        String trimmedComments = comments == null || comments.isBlank() ? null : comments.trim();
        if (outcome == DecisionOutcome.REJECT && trimmedComments == null) {
            auditService.logDenied(reviewer, action, claim, "Rejection without a comment");
            throw ValidationException.forField("approvalActionRequest", "comments", "A comment is required when rejecting");
        }

        ClaimStatus target = next.get();
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = expenseClaimRepository.transitionStatus(claimId, current, target, now);
        if (updated == 0) {
            ClaimStatus actual = expenseClaimRepository.findById(claimId).map(ExpenseClaim::getStatus).orElse(current);
            auditService.logDenied(reviewer, action, claim, "Claim moved to " + actual.getValue() + " concurrently");
            throw new InvalidStateException(String.format(
                    "Claim %s was already processed by another reviewer", claim.getExpenseNumber()), actual);
        }

        ExpenseClaim transitioned = expenseClaimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", claimId));
        if (target == ClaimStatus.APPROVED) {
            transitioned.setApprovedAt(now);
        } else if (target == ClaimStatus.REJECTED) {
            transitioned.setRejectedAt(now);
            transitioned.setRejectionReason(String.format("Rejected at %s review: %s",
                    reviewer.getRole().getValue(), trimmedComments));
        }
        expenseClaimRepository.save(transitioned);

        approvalDecisionRepository.save(ApprovalDecision.builder()
                .claim(transitioned)
                .actor(reviewer)
                .actorName(reviewer.getFullName())
                .actorRole(reviewer.getRole())
                .outcome(outcome)
                .comments(trimmedComments)
                .fromStatus(current)
                .toStatus(target)
                .decidedAt(now)
                .build());

        auditService.logClaimAction(reviewer, action, transitioned, current, target, trimmedComments);

        eventPublisher.publishEvent(ClaimStatusChangedEvent.builder()
                .claimId(transitioned.getId())
                .expenseNumber(transitioned.getExpenseNumber())
                .ownerId(transitioned.getOwner().getId())
                .ownerName(transitioned.getOwnerName())
                .amount(transitioned.getAmount())
                .fromStatus(current)
                .toStatus(target)
                .actorId(reviewer.getId())
                .actorName(reviewer.getFullName())
                .actorRole(reviewer.getRole())
                .comments(trimmedComments)
                .build());

        log.info("Claim {} {} by {} ({}): {} -> {}", transitioned.getExpenseNumber(),
                outcome == DecisionOutcome.APPROVE ? "approved" : "rejected",
                reviewer.getUsername(), reviewer.getRole(), current, target);

        List<ApprovalDecision> decisions = approvalDecisionRepository.findByClaim_IdOrderByDecidedAtAsc(claimId);
        return claimMapper.toResponse(transitioned, decisions, reviewer);
    }
}
