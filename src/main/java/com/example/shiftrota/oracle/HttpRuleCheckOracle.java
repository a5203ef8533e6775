package com.example.shiftrota.oracle;

import com.example.shiftrota.schedule.Schedule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Posts the rules and the schedule to an external checker and reads back {@code {is_valid, violations}}.
 */
@Component
@ConditionalOnProperty(name = "rotation.oracle.enabled", havingValue = "true")
public class HttpRuleCheckOracle implements RuleCheckOracle {

    private static final Logger logger = LoggerFactory.getLogger(HttpRuleCheckOracle.class);

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;

    public HttpRuleCheckOracle(RestTemplateBuilder builder,
                               @Value("${rotation.oracle.url}") String url,
                               @Value("${rotation.oracle.timeout:PT20S}") Duration timeout,
                               @Value("${rotation.oracle.api-key:}") String apiKey) {
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        this.url = url;
        this.apiKey = apiKey;
        logger.info("Rule-check oracle enabled at {} (timeout {})", url, timeout);
    }

    @Override
    public OracleReport check(Schedule schedule, String rulesText) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        Map<String, Object> body = Map.of("rules", rulesText, "schedule", schedule);
        try {
            OracleAnswer answer = restTemplate.postForObject(url, new HttpEntity<>(body, headers), OracleAnswer.class);
            if (answer == null || answer.valid() == null) {
                logger.warn("Rule-check oracle returned no verdict");
                return OracleReport.unavailable("empty response");
            }
            return new OracleReport(true, answer.valid(), answer.violations(), "");
        } catch (RestClientException e) {
            logger.warn("Rule-check oracle call failed: {}", e.getMessage());
            return OracleReport.unavailable(e.getClass().getSimpleName());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OracleAnswer(@JsonProperty("is_valid") Boolean valid,
                        @JsonProperty("violations") List<String> violations) {
    }
}
