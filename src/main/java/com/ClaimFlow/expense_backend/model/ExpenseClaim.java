package com.ClaimFlow.expense_backend.model;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "expense_claims", indexes = {
        @Index(name = "idx_expense_claims_status", columnList = "status"),
        @Index(name = "idx_expense_claims_owner", columnList = "owner_id"),
        @Index(name = "idx_expense_claims_bill_hash", columnList = "bill_file_hash")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseClaim {

    public static final int PLACE_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 32)
    private String expenseNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    private String ownerName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpenseCategory category;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "INR";

    @Column(nullable = false)
    private LocalDate expenseDate;

    @Column(nullable = false, length = 2000)
    private String description;

    @Column(length = 30)
    private TravelMode travelMode;

    @Column(length = PLACE_LENGTH)
    private String travelFrom;

    @Column(length = PLACE_LENGTH)
    private String travelTo;

    @Column(nullable = false)
    private String billFilePath;

    private String billFileName;

    private String billContentType;

    @Column(name = "bill_file_hash", length = 64)
    private String billFileHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ClaimStatus status = ClaimStatus.SUBMITTED;

    private boolean withinLimits;

    @Column(length = 500)
    private String limitReason;

    private boolean analysisPresent;

    @Embedded
    private BillAnalysis billAnalysis;

    @OneToMany(mappedBy = "claim", fetch = FetchType.LAZY)
    @OrderBy("decidedAt ASC")
    @Builder.Default
    private List<ApprovalDecision> decisions = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String rejectionReason;

    private LocalDateTime submittedAt;

    private LocalDateTime approvedAt;

    private LocalDateTime rejectedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getId() != null && owner.getId().equals(userId);
    }
}
