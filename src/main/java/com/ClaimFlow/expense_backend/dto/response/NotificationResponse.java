package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.NotificationType;
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
public class NotificationResponse {
    private UUID id;
    private NotificationType type;
    private String title;
    private String message;
    private UUID claimId;
    private String expenseNumber;
    private boolean read;
    private LocalDateTime createdAt;
    private LocalDateTime readAt;
}
