package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.config.GeminiProperties;
import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Sends the bill inline with the audit prompt to Gemini's {@code generateContent} endpoint.
 * One attempt per claim; transport errors and timeouts surface as {@link AnalysisUnavailableException}.
 */
@Slf4j
public class GeminiBillAnalyzer implements BillAnalyzer {

    private final RestClient restClient;
    private final GeminiProperties properties;
    private final BillPromptBuilder promptBuilder;
    private final BillAnalysisParser analysisParser;

    public GeminiBillAnalyzer(RestClient restClient,
                              GeminiProperties properties,
                              BillPromptBuilder promptBuilder,
                              BillAnalysisParser analysisParser) {
        this.restClient = restClient;
        this.properties = properties;
        this.promptBuilder = promptBuilder;
        this.analysisParser = analysisParser;
    }

    @Override
    public BillAnalysis analyze(BillDocument document, ClaimContext context) {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(
                        Map.of("text", promptBuilder.build(context)),
                        Map.of("inline_data", Map.of(
                                "mime_type", document.getContentType(),
                                "data", Base64.getEncoder().encodeToString(document.getContent())
                        ))
                ))),
                "generationConfig", Map.of(
                        "temperature", 0.1,
                        "responseMimeType", "application/json"
                )
        );

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/models/{model}:generateContent")
                            .queryParam("key", properties.getApiKey())
                            .build(properties.getModel()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Bill analysis call failed for {}: {}", document.getFileName(), e.getMessage());
            throw new AnalysisUnavailableException("Bill analysis service unavailable", e);
        }

        String text = extractText(response);
        BillAnalysis analysis = analysisParser.parse(text);
        log.info("Bill {} analysed: recommendation={}, confidence={}",
                document.getFileName(), analysis.getRecommendation(), analysis.getConfidenceScore());
        return analysis;
    }

    private String extractText(JsonNode response) {
        JsonNode text = response == null ? null : response.path("candidates").path(0)
                .path("content").path("parts").path(0).path("text");
        if (text == null || text.isMissingNode() || !text.isTextual()) {
            throw new AnalysisUnavailableException("Analysis response carried no text candidate");
        }
        return text.asText();
    }
}
