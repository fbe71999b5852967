package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.AuditOutcome;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditLogResponse {
    private UUID id;
    private UUID actorId;
    private String actorUsername;
    private Role actorRole;
    private AuditAction action;
    private AuditOutcome outcome;
    private UUID claimId;
    private String expenseNumber;
    private UUID targetUserId;
    private ClaimStatus beforeStatus;
    private ClaimStatus afterStatus;
    private String detail;
    private String ipAddress;
    private LocalDateTime createdAt;
}
