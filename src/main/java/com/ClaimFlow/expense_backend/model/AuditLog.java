package com.ClaimFlow.expense_backend.model;

import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.AuditOutcome;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.Role;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only compliance record. Every column is insert-only.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_logs_claim", columnList = "claim_id"),
        @Index(name = "idx_audit_logs_actor", columnList = "actor_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Column(updatable = false)
    private String actorUsername;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 20)
    private Role actorRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private AuditOutcome outcome;

    @Column(name = "claim_id", updatable = false)
    private UUID claimId;

    @Column(updatable = false)
    private String expenseNumber;

    @Column(updatable = false)
    private UUID targetUserId;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 20)
    private ClaimStatus beforeStatus;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 20)
    private ClaimStatus afterStatus;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(updatable = false, length = 45)
    private String ipAddress;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
