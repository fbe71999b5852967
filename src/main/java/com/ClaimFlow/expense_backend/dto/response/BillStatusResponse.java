package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
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
public class BillStatusResponse {
    private UUID id;
    private String expenseNumber;
    private ClaimStatus status;
    private String pendingWith;
    private boolean analysisPresent;
    private String rejectionReason;
    private LocalDateTime submittedAt;
    private LocalDateTime updatedAt;
}
