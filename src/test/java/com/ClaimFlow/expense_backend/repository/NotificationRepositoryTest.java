package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.NotificationType;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.model.Notification;
import com.ClaimFlow.expense_backend.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class NotificationRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private NotificationRepository notificationRepository;

    private User asha;
    private User ravi;

    @BeforeEach
    void setUp() {
        asha = entityManager.persist(user("asha", "EMP001"));
        ravi = entityManager.persist(user("ravi", "EMP002"));

        entityManager.persist(notification(asha, NotificationType.EXPENSE_SUBMITTED, false));
        entityManager.persist(notification(asha, NotificationType.EXPENSE_SUBMITTED, true));
        entityManager.persist(notification(asha, NotificationType.EXPENSE_APPROVED, false));
        entityManager.persistAndFlush(notification(ravi, NotificationType.APPROVAL_REQUIRED, false));
    }

    @Test
    void typeCountsCoverOnlyTheRecipient() {
        Map<NotificationType, Long> byType = new HashMap<>();
        for (Object[] row : notificationRepository.countByTypeForRecipient(asha.getId())) {
            byType.put((NotificationType) row[0], ((Number) row[1]).longValue());
        }

        assertThat(byType).containsOnly(
                Map.entry(NotificationType.EXPENSE_SUBMITTED, 2L),
                Map.entry(NotificationType.EXPENSE_APPROVED, 1L));
        assertThat(notificationRepository.countByRecipient_Id(asha.getId())).isEqualTo(3);
        assertThat(notificationRepository.countByRecipient_IdAndReadFalse(asha.getId())).isEqualTo(2);
    }

    @Test
    void clearingLeavesOtherRecipientsAlone() {
        int deleted = notificationRepository.deleteAllForRecipient(asha.getId());
        entityManager.clear();

        assertThat(deleted).isEqualTo(3);
        assertThat(notificationRepository.countByRecipient_Id(asha.getId())).isZero();
        assertThat(notificationRepository.countByRecipient_Id(ravi.getId())).isEqualTo(1);
    }

    private static User user(String username, String code) {
        return User.builder()
                .username(username)
                .email(username + "@example.com")
                .password("{noop}secret")
                .fullName(username)
                .employeeCode(code)
                .role(Role.EMPLOYEE)
                .grade(Grade.B)
                .build();
    }

    private static Notification notification(User recipient, NotificationType type, boolean read) {
        return Notification.builder()
                .recipient(recipient)
                .type(type)
                .title("Title")
                .message("Message")
                .read(read)
                .build();
    }
}
