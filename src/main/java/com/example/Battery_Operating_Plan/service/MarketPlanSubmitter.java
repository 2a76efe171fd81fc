package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.SubmissionProperties;
import com.example.Battery_Operating_Plan.dto.CopSubmissionPayload;
import com.example.Battery_Operating_Plan.dto.SubmissionRecord;
import com.example.Battery_Operating_Plan.dto.SubmissionResult;
import com.example.Battery_Operating_Plan.dto.SubmissionStatus;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Submits COPs to the market operator over HTTP
 *
 * - Test mode: payload is built and sized, nothing leaves the process
 * - Live mode: JSON POST with bearer authentication, synchronous with a timeout
 * Every attempt is recorded in a bounded in-memory history (cop.submission.history-size).
 */
@Service
public class MarketPlanSubmitter implements PlanSubmitter {

    private static final Logger logger = LoggerFactory.getLogger(MarketPlanSubmitter.class);

    private static final DateTimeFormatter TEST_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final SubmissionProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Deque<SubmissionRecord> submissionHistory = new ArrayDeque<>();

    public MarketPlanSubmitter(WebClient.Builder webClientBuilder,
                               SubmissionProperties properties,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public SubmissionResult submit(Plan plan, boolean testMode) {
        CopSubmissionPayload payload = formatForMarket(plan);

        SubmissionResult result = testMode ? simulateSubmission(payload) : sendToMarket(payload);

        record(new SubmissionRecord(LocalDateTime.now(clock), result, plan.size(), plan.getStart(), plan.getEnd()));

        logger.info("COP submission for {} ({} hours, testMode={}): {}",
                plan.resourceName, plan.size(), testMode, result.status);
        return result;
    }

    @Override
    public synchronized List<SubmissionRecord> getSubmissionHistory() {
        return new ArrayList<>(submissionHistory);
    }

    /**
     * Most recent recorded outcome for a plan id
     */
    @Override
    public synchronized SubmissionStatus checkSubmissionStatus(String planId) {
        if (planId != null) {
            Iterator<SubmissionRecord> newestFirst = submissionHistory.descendingIterator();
            while (newestFirst.hasNext()) {
                SubmissionResult result = newestFirst.next().result;
                if (result != null && planId.equals(result.planId)) {
                    return new SubmissionStatus(planId, result);
                }
            }
        }
        logger.debug("No submission recorded for plan id {}", planId);
        return SubmissionStatus.notFound(planId);
    }

    private synchronized void record(SubmissionRecord entry) {
        submissionHistory.addLast(entry);
        int limit = Math.max(1, properties.getHistorySize());
        while (submissionHistory.size() > limit) {
            submissionHistory.removeFirst();
        }
    }

    /**
     * Convert a plan to the market submission format
     */
    public CopSubmissionPayload formatForMarket(Plan plan) {
        List<CopSubmissionPayload.CopEntry> copData = new ArrayList<>(plan.size());

        for (PlanHour hour : plan.hours) {
            CopSubmissionPayload.CopEntry entry = new CopSubmissionPayload.CopEntry();
            entry.hourEnding = hour.hourEnding != null ? hour.hourEnding.toString() : null;
            entry.resourceName = plan.resourceName;
            entry.resourceStatus = hour.status != null ? hour.status.name() : null;
            entry.hsl = hour.hsl;
            entry.lsl = hour.lsl;
            entry.hel = hour.hel != null ? hour.hel : hour.hsl;
            entry.lel = hour.lel != null ? hour.lel : hour.lsl;
            entry.normalRampRateUp = hour.normalRampUp;
            entry.normalRampRateDown = hour.normalRampDown;
            entry.emergencyRampRateUp = hour.emergencyRampUp != null ? hour.emergencyRampUp : scaled(hour.normalRampUp);
            entry.emergencyRampRateDown = hour.emergencyRampDown != null ? hour.emergencyRampDown : scaled(hour.normalRampDown);
            entry.minimumSoc = hour.socMin;
            entry.maximumSoc = hour.socMax;
            entry.hourBeginningPlannedSoc = hour.socBegin;
            copData.add(entry);
        }

        return new CopSubmissionPayload(properties.getQseName(), LocalDateTime.now(clock).toString(), copData);
    }

    private SubmissionResult simulateSubmission(CopSubmissionPayload payload) {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            byte[] body = objectMapper.writeValueAsBytes(payload);

            SubmissionResult result = new SubmissionResult(SubmissionResult.Status.TEST_SUCCESS,
                    "COP validated and ready for submission (test mode)", now.toString());
            result.planId = "TEST_" + now.format(TEST_ID_FORMAT);
            result.payloadSize = body.length;
            return result;
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize COP payload", e);
            return failure("Submission failed: payload could not be serialized", e.getOriginalMessage());
        }
    }

    private SubmissionResult sendToMarket(CopSubmissionPayload payload) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            logger.warn("COP submission skipped: no API key configured for {}", properties.getEndpoint());
            return failure("Submission failed: API key not configured", "missing cop.submission.api-key");
        }

        try {
            ResponseEntity<Map<String, Object>> response = webClient.post()
                    .uri(properties.getEndpoint())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .bodyValue(payload)
                    .retrieve()
                    .toEntity(JSON_MAP)
                    .block(Duration.ofSeconds(properties.getTimeoutSeconds()));

            if (response != null && response.getStatusCode().isSameCodeAs(HttpStatus.OK)) {
                Map<String, Object> body = response.getBody();
                SubmissionResult result = new SubmissionResult(SubmissionResult.Status.SUCCESS,
                        "COP submitted successfully", LocalDateTime.now(clock).toString());
                result.planId = body != null && body.get("cop_id") != null ? String.valueOf(body.get("cop_id")) : null;
                return result;
            }

            int statusCode = response != null ? response.getStatusCode().value() : 0;
            return failure("Submission failed: " + statusCode, response != null ? String.valueOf(response.getBody()) : null);
        } catch (WebClientResponseException e) {
            logger.warn("COP submission rejected: {} {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            return failure("Submission failed: " + e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (Exception e) {
            logger.error("COP submission to {} failed", properties.getEndpoint(), e);
            return failure("Submission failed: " + e.getMessage(), e.toString());
        }
    }

    private SubmissionResult failure(String message, String error) {
        SubmissionResult result = new SubmissionResult(SubmissionResult.Status.ERROR, message,
                LocalDateTime.now(clock).toString());
        result.error = error;
        return result;
    }

    private static Double scaled(Double normalRamp) {
        return normalRamp != null ? normalRamp * 1.5 : null;
    }
}
