package com.ClaimFlow.expense_backend.dto.response;

import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GradeRulesResponse {
    private Grade grade;
    private String currency;
    private Map<String, BigDecimal> limits;
    private List<TravelMode> allowedTravelModes;
}
