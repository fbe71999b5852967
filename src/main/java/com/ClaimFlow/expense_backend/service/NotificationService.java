package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.response.NotificationResponse;
import com.ClaimFlow.expense_backend.dto.response.NotificationStatsResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.NotificationType;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.event.ClaimStatusChangedEvent;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.model.Notification;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.NotificationRepository;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ApprovalStateMachine stateMachine;
    private final ModelMapper modelMapper;
    private final Clock clock;

    /**
     * Owner always hears about the new status. When the claim now waits on a review stage,
     * every active user of that stage's role is asked to act, except the owner.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<Notification> handleClaimStatusChanged(ClaimStatusChangedEvent event) {
        List<Notification> created = new ArrayList<>();
        User owner = userRepository.findById(event.getOwnerId())
                .orElseThrow(() -> new ResourceNotFoundException("User", "id", event.getOwnerId()));

        created.add(notifyOwner(owner, event));

        Optional<Role> nextStageRole = stateMachine.stageRole(event.getToStatus());
        if (nextStageRole.isPresent()) {
            for (User reviewer : userRepository.findAllByRoleAndActiveTrue(nextStageRole.get())) {
                if (reviewer.getId().equals(owner.getId())) {
                    continue;
                }
                created.add(create(reviewer, NotificationType.APPROVAL_REQUIRED,
                        "Approval required",
                        String.format("Expense %s from %s (%s) is waiting for your review",
                                event.getExpenseNumber(), event.getOwnerName(), event.getAmount()),
                        event));
            }
        }

        log.info("Notifications sent for {} -> {}: {}", event.getExpenseNumber(), event.getToStatus(), created.size());
        return created;
    }

    private Notification notifyOwner(User owner, ClaimStatusChangedEvent event) {
        ClaimStatus status = event.getToStatus();
        if (event.getFromStatus() == null) {
            return create(owner, NotificationType.EXPENSE_SUBMITTED, "Expense submitted",
                    String.format("Your expense %s has been submitted for review", event.getExpenseNumber()), event);
        }
        if (status == ClaimStatus.REJECTED) {
            String reason = event.getComments() == null || event.getComments().isBlank()
                    ? "" : ": " + event.getComments();
            return create(owner, NotificationType.EXPENSE_REJECTED, "Expense rejected",
                    String.format("Your expense %s was rejected by %s%s",
                            event.getExpenseNumber(), event.getActorRole().getValue(), reason), event);
        }
        if (status == ClaimStatus.APPROVED) {
            return create(owner, NotificationType.EXPENSE_APPROVED, "Expense approved",
                    String.format("Your expense %s has been fully approved", event.getExpenseNumber()), event);
        }
        return create(owner, NotificationType.EXPENSE_APPROVED, "Expense moved forward",
                String.format("Your expense %s was approved by %s and is now in %s",
                        event.getExpenseNumber(), event.getActorRole().getValue(), status.getValue()), event);
    }

    private Notification create(User recipient, NotificationType type, String title, String message,
                                ClaimStatusChangedEvent event) {
        Notification notification = Notification.builder()
                .recipient(recipient)
                .type(type)
                .title(title)
                .message(message)
                .claimId(event.getClaimId())
                .expenseNumber(event.getExpenseNumber())
                .build();
        return notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<NotificationResponse> getMyNotifications(User user, boolean unreadOnly, int page, int limit) {
        Pageable pageable = PageRequest.of(page - 1, limit);
        Page<Notification> notifications = unreadOnly
                ? notificationRepository.findByRecipient_IdAndReadFalseOrderByCreatedAtDesc(user.getId(), pageable)
                : notificationRepository.findByRecipient_IdOrderByCreatedAtDesc(user.getId(), pageable);

        return PaginatedResponse.from(notifications, this::mapToNotificationResponse);
    }

    @Transactional(readOnly = true)
    public long getUnreadCount(User user) {
        return notificationRepository.countByRecipient_IdAndReadFalse(user.getId());
    }

    @Transactional
    public NotificationResponse markAsRead(User user, UUID notificationId) {
        Notification notification = findOwned(user, notificationId);
        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(LocalDateTime.now(clock));
            notification = notificationRepository.save(notification);
        }
        return mapToNotificationResponse(notification);
    }

    @Transactional
    public int markAllAsRead(User user) {
        int updated = notificationRepository.markAllRead(user.getId(), LocalDateTime.now(clock));
        log.info("Marked {} notifications read for {}", updated, user.getUsername());
        return updated;
    }

    @Transactional
    public int clearAll(User user) {
        int deleted = notificationRepository.deleteAllForRecipient(user.getId());
        log.info("Cleared {} notifications for {}", deleted, user.getUsername());
        return deleted;
    }

    @Transactional(readOnly = true)
    public NotificationStatsResponse getStats(User user) {
        long total = notificationRepository.countByRecipient_Id(user.getId());
        long unread = notificationRepository.countByRecipient_IdAndReadFalse(user.getId());

        Map<String, Long> byType = new LinkedHashMap<>();
        for (Object[] row : notificationRepository.countByTypeForRecipient(user.getId())) {
            byType.put(((NotificationType) row[0]).getValue(), ((Number) row[1]).longValue());
        }

        return NotificationStatsResponse.builder()
                .total(total)
                .unread(unread)
                .read(total - unread)
                .byType(byType)
                .build();
    }

    @Transactional
    public void deleteNotification(User user, UUID notificationId) {
        Notification notification = findOwned(user, notificationId);
        notificationRepository.delete(notification);
        log.debug("Notification {} deleted by {}", notificationId, user.getUsername());
    }

    // Someone else's notification is reported as missing, not forbidden
    private Notification findOwned(User user, UUID notificationId) {
        return notificationRepository.findByIdAndRecipient_Id(notificationId, user.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Notification", "id", notificationId));
    }

    private NotificationResponse mapToNotificationResponse(Notification notification) {
        return modelMapper.map(notification, NotificationResponse.class);
    }
}
