package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.service.analysis.BillAnalysisParser;
import com.ClaimFlow.expense_backend.service.analysis.BillAnalyzer;
import com.ClaimFlow.expense_backend.service.analysis.BillPromptBuilder;
import com.ClaimFlow.expense_backend.service.analysis.GeminiBillAnalyzer;
import com.ClaimFlow.expense_backend.service.analysis.NoOpBillAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@Slf4j
public class BillAnalyzerConfig {

    @Bean
    public BillAnalyzer billAnalyzer(GeminiProperties geminiProperties,
                                     BillPromptBuilder promptBuilder,
                                     BillAnalysisParser analysisParser,
                                     RestClient.Builder restClientBuilder) {
        if (!geminiProperties.isConfigured()) {
            log.warn("No Gemini API key configured; bill analysis is disabled");
            return new NoOpBillAnalyzer();
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) geminiProperties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) geminiProperties.getReadTimeout().toMillis());

        RestClient restClient = restClientBuilder
                .baseUrl(geminiProperties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();

        log.info("Bill analysis enabled with model {}", geminiProperties.getModel());
        return new GeminiBillAnalyzer(restClient, geminiProperties, promptBuilder, analysisParser);
    }
}
