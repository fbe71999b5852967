package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.DecisionOutcome;
import com.ClaimFlow.expense_backend.enums.Role;
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
public class DecisionResponse {
    private UUID id;
    private String actorName;
    private Role actorRole;
    private DecisionOutcome outcome;
    private String comments;
    private ClaimStatus fromStatus;
    private ClaimStatus toStatus;
    private LocalDateTime decidedAt;
}
