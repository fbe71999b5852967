package com.ClaimFlow.expense_backend.event;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.Role;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Published whenever a claim enters a new status, including its creation ({@code fromStatus} null).
 */
@Value
@Builder
public class ClaimStatusChangedEvent {
    UUID claimId;
    String expenseNumber;
    UUID ownerId;
    String ownerName;
    BigDecimal amount;
    ClaimStatus fromStatus;
    ClaimStatus toStatus;
    UUID actorId;
    String actorName;
    Role actorRole;
    String comments;
}
