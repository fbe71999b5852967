package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.DecisionOutcome;
import com.ClaimFlow.expense_backend.enums.Role;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed review chain manager -> HR -> finance as an explicit table.
 * Every (status, role, outcome) combination absent from the table is undefined.
 */
@Component
public class ApprovalStateMachine {

    private static final Map<ClaimStatus, Stage> STAGES;

    static {
        Map<ClaimStatus, Stage> stages = new EnumMap<>(ClaimStatus.class);
        stages.put(ClaimStatus.SUBMITTED, new Stage(Role.MANAGER, ClaimStatus.HR_REVIEW));
        stages.put(ClaimStatus.MANAGER_REVIEW, new Stage(Role.MANAGER, ClaimStatus.HR_REVIEW));
        stages.put(ClaimStatus.HR_REVIEW, new Stage(Role.HR, ClaimStatus.FINANCE_REVIEW));
        stages.put(ClaimStatus.FINANCE_REVIEW, new Stage(Role.FINANCE, ClaimStatus.APPROVED));
        STAGES = Collections.unmodifiableMap(stages);
    }

    /**
     * Role that must act on a claim in {@code status}; empty for terminal states.
     */
    public Optional<Role> stageRole(ClaimStatus status) {
        Stage stage = STAGES.get(status);
        return stage == null ? Optional.empty() : Optional.of(stage.getRole());
    }

    /**
     * Statuses whose claims wait on {@code role}; empty for roles that never review.
     */
    public Set<ClaimStatus> statusesAwaiting(Role role) {
        Set<ClaimStatus> statuses = EnumSet.noneOf(ClaimStatus.class);
        STAGES.forEach((status, stage) -> {
            if (stage.getRole() == role) {
                statuses.add(status);
            }
        });
        return statuses;
    }

    /**
     * @return the next status, or empty when the combination is not in the table
     */
    public Optional<ClaimStatus> next(ClaimStatus current, Role role, DecisionOutcome outcome) {
        Stage stage = STAGES.get(current);
        if (stage == null || stage.getRole() != role) {
            return Optional.empty();
        }
        return Optional.of(outcome == DecisionOutcome.APPROVE ? stage.getOnApprove() : ClaimStatus.REJECTED);
    }

    @Value
    private static class Stage {
        Role role;
        ClaimStatus onApprove;
    }
}
