package com.ClaimFlow.expense_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Admin dashboard counters over every account and claim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatsResponse {
    private Users users;
    private Claims claims;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Users {
        private long total;
        private long active;
        private long inactive;
        private Map<String, Long> byRole;
        private Map<String, Long> byGrade;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Claims {
        private long total;
        private long pendingManager;
        private long pendingHr;
        private long pendingFinance;
        private long approved;
        private long rejected;
        private BigDecimal totalClaimedAmount;
        private BigDecimal totalApprovedAmount;
    }
}
