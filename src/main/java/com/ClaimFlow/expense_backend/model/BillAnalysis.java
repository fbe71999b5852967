package com.ClaimFlow.expense_backend.model;

import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of the model's opinion about a bill, taken once at submission.
 * Advisory only: reviewers may decide against it.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BillAnalysis {

    public static final int TEXT_LENGTH = 255;
    public static final int FLAG_LENGTH = 1000;
    public static final int AMOUNT_PRECISION = 12;
    public static final int AMOUNT_SCALE = 2;

    @Column(name = "ai_is_authentic")
    private Boolean authentic;

    @Column(name = "ai_confidence_score")
    private Integer confidenceScore;

    @Column(name = "ai_bill_number", length = TEXT_LENGTH)
    private String billNumber;

    @Column(name = "ai_bill_date")
    private LocalDate billDate;

    @Column(name = "ai_vendor_name", length = TEXT_LENGTH)
    private String vendorName;

    @Column(name = "ai_extracted_amount", precision = AMOUNT_PRECISION, scale = AMOUNT_SCALE)
    private BigDecimal extractedAmount;

    @Column(name = "ai_has_gst")
    private Boolean hasGst;

    @Column(name = "ai_travel_mode", length = TEXT_LENGTH)
    private String travelMode;

    @Column(name = "ai_travel_route", length = TEXT_LENGTH)
    private String travelRoute;

    @Enumerated(EnumType.STRING)
    @Column(name = "ai_recommendation", length = 10)
    private AiRecommendation recommendation;

    @Column(name = "ai_recommendation_reason", columnDefinition = "TEXT")
    private String recommendationReason;

    @Column(name = "ai_summary", columnDefinition = "TEXT")
    private String summary;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_claim_flags", joinColumns = @JoinColumn(name = "claim_id"))
    @OrderColumn(name = "position")
    @Column(name = "flag", length = FLAG_LENGTH)
    @Builder.Default
    private List<String> flaggedIssues = new ArrayList<>();
}
