package com.ClaimFlow.expense_backend.event;

import com.ClaimFlow.expense_backend.model.Notification;
import com.ClaimFlow.expense_backend.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Turns committed claim transitions into in-app notifications. Runs after commit, so a failure
 * here never rolls back the transition itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationEventListener {

    private final NotificationService notificationService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onClaimStatusChanged(ClaimStatusChangedEvent event) {
        try {
            List<Notification> created = notificationService.handleClaimStatusChanged(event);
            log.debug("Created {} notifications for claim {} -> {}",
                    created.size(), event.getExpenseNumber(), event.getToStatus());
        } catch (Exception e) {
            log.warn("Failed to create notifications for claim {} -> {}",
                    event.getExpenseNumber(), event.getToStatus(), e);
        }
    }
}
