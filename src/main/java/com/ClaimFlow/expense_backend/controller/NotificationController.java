package com.ClaimFlow.expense_backend.controller;

import com.ClaimFlow.expense_backend.dto.response.ApiResponse;
import com.ClaimFlow.expense_backend.dto.response.NotificationResponse;
import com.ClaimFlow.expense_backend.dto.response.NotificationStatsResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.dto.response.UnreadCountResponse;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.service.NotificationService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Validated
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping("/my-notifications")
    public ResponseEntity<ApiResponse<PaginatedResponse<NotificationResponse>>> getMyNotifications(
            @AuthenticationPrincipal User user,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {

        return ResponseEntity.ok(ApiResponse.success(
                notificationService.getMyNotifications(user, unreadOnly, page, limit)));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<ApiResponse<UnreadCountResponse>> getUnreadCount(@AuthenticationPrincipal User user) {
        UnreadCountResponse response = new UnreadCountResponse(notificationService.getUnreadCount(user));
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @PutMapping("/{id}/read")
    public ResponseEntity<ApiResponse<NotificationResponse>> markAsRead(@AuthenticationPrincipal User user,
                                                                        @PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(notificationService.markAsRead(user, id),
                "Notification marked as read"));
    }

    @PutMapping("/mark-all-read")
    public ResponseEntity<ApiResponse<Integer>> markAllAsRead(@AuthenticationPrincipal User user) {
        int updated = notificationService.markAllAsRead(user);
        return ResponseEntity.ok(ApiResponse.success(updated, updated + " notifications marked as read"));
    }

    @GetMapping("/notification-stats")
    public ResponseEntity<ApiResponse<NotificationStatsResponse>> getStats(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(ApiResponse.success(notificationService.getStats(user)));
    }

    @DeleteMapping("/clear-all")
    public ResponseEntity<ApiResponse<Integer>> clearAll(@AuthenticationPrincipal User user) {
        int deleted = notificationService.clearAll(user);
        String message = deleted == 0 ? "No notifications to clear" : deleted + " notifications cleared";
        return ResponseEntity.ok(ApiResponse.success(deleted, message));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteNotification(@AuthenticationPrincipal User user,
                                                                @PathVariable UUID id) {
        notificationService.deleteNotification(user, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Notification deleted"));
    }
}
