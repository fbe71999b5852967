package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the model's free-text reply into a {@link BillAnalysis}. The reply must hold one JSON object
 * with a numeric {@code confidence_score} in 0..100 and a known {@code recommendation}; anything
 * else is rejected as unavailable rather than guessed at. Optional fields are clipped to the snapshot
 * column sizes, and amounts that cannot be stored are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillAnalysisParser {

    private static final Pattern FIRST_NUMBER = Pattern.compile("-?\\d[\\d,]*(?:\\.\\d+)?");
    private static final BigDecimal MAX_AMOUNT =
            BigDecimal.TEN.pow(BillAnalysis.AMOUNT_PRECISION - BillAnalysis.AMOUNT_SCALE);

    private final ObjectMapper objectMapper;

    public BillAnalysis parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new AnalysisUnavailableException("Empty response from analysis model");
        }

        String json = extractJsonObject(responseText);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Analysis response is not valid JSON: {}", e.getOriginalMessage());
            throw new AnalysisUnavailableException("Analysis response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisUnavailableException("Analysis response is not a JSON object");
        }

        JsonNode score = root.get("confidence_score");
        if (score == null || !score.isNumber()) {
            throw new AnalysisUnavailableException("confidence_score is missing or not numeric");
        }
        double scoreValue = score.asDouble();
        if (scoreValue < 0 || scoreValue > 100) {
            throw new AnalysisUnavailableException("confidence_score out of range: " + scoreValue);
        }

        AiRecommendation recommendation = AiRecommendation.fromString(text(root, "recommendation"));
        if (recommendation == null) {
            throw new AnalysisUnavailableException("recommendation must be APPROVE, REJECT or REVIEW");
        }

        List<String> flaggedIssues = new ArrayList<>();
        collectStrings(root, "red_flags", flaggedIssues);
        collectStrings(root, "missing_elements", flaggedIssues);

        return BillAnalysis.builder()
                .authentic(bool(root, "is_authentic"))
                .confidenceScore((int) Math.round(scoreValue))
                .billNumber(clip(text(root, "bill_number"), BillAnalysis.TEXT_LENGTH))
                .billDate(date(root, "bill_date"))
                .vendorName(clip(text(root, "vendor_name"), BillAnalysis.TEXT_LENGTH))
                .extractedAmount(amount(root, "extracted_amount"))
                .hasGst(bool(root, "has_gst"))
                .travelMode(clip(text(root, "travel_mode"), BillAnalysis.TEXT_LENGTH))
                .travelRoute(clip(text(root, "travel_route"), BillAnalysis.TEXT_LENGTH))
                .recommendation(recommendation)
                .recommendationReason(text(root, "recommendation_reason"))
                .summary(text(root, "summary"))
                .flaggedIssues(flaggedIssues)
                .build();
    }

    /**
     * Drops markdown fences and any prose around the outermost braces.
     */
    String extractJsonObject(String responseText) {
        String cleaned = responseText.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start == -1 || end <= start) {
            throw new AnalysisUnavailableException("No JSON object found in analysis response");
        }
        return cleaned.substring(start, end + 1);
    }

    private void collectStrings(JsonNode root, String field, List<String> target) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isArray()) {
            throw new AnalysisUnavailableException(field + " must be an array");
        }
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                target.add(clip(item.asText().trim(), BillAnalysis.FLAG_LENGTH));
            }
        }
    }

    private String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }

    private Boolean bool(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isBoolean()) {
            return null;
        }
        return node.booleanValue();
    }

    private BigDecimal amount(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else {
            value = firstNumber(text(root, field));
        }
        if (value == null) {
            return null;
        }
        BigDecimal rounded = value.setScale(BillAnalysis.AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (rounded.signum() < 0 || rounded.compareTo(MAX_AMOUNT) >= 0) {
            log.debug("Ignoring out-of-range {}: {}", field, value);
            return null;
        }
        return rounded;
    }

    /**
     * First numeric token of a free-text amount, e.g. {@code "1,234.5 (incl. 5.0 GST)"} gives 1234.5.
     */
    BigDecimal firstNumber(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = FIRST_NUMBER.matcher(raw);
        if (!matcher.find()) {
            log.debug("Ignoring unparseable amount: {}", raw);
            return null;
        }
        return new BigDecimal(matcher.group().replace(",", ""));
    }

    private LocalDate date(JsonNode root, String field) {
        String raw = text(root, field);
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable {}: {}", field, raw);
            return null;
        }
    }

    static String clip(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
