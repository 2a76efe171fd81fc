package com.example.Battery_Operating_Plan.simulator;

import com.example.Battery_Operating_Plan.dto.CommitmentEntry;
import com.example.Battery_Operating_Plan.dto.DailyRunRequest;
import com.example.Battery_Operating_Plan.dto.GeneratePlanRequest;
import com.example.Battery_Operating_Plan.dto.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * COP Scenario Simulator
 *
 * Exercises the running API with four scenarios:
 * 1. Default diurnal plan, generated then validated
 * 2. Price-based plan from a synthetic 7-day forecast (peak / off-peak / shoulder)
 * 3. Default plan with regulation, RRS and ECRS awards
 * 4. Daily run without auto-submit
 *
 * Run with: --simulator.enabled=true
 */
@Component
@ConditionalOnProperty(name = "simulator.enabled", havingValue = "true", matchIfMissing = false)
public class PlanScenarioSimulator implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(PlanScenarioSimulator.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final Random random = new Random(42);

    public PlanScenarioSimulator(WebClient.Builder webClientBuilder,
                                 @Value("${simulator.base-url:http://localhost:8080/api/v1}") String baseUrl) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public void run(String... args) throws Exception {
        logger.info("=".repeat(80));
        logger.info("BATTERY OPERATING PLAN - SCENARIO SIMULATOR");
        logger.info("=".repeat(80));

        // Wait for application to fully start
        Thread.sleep(2000);

        LocalDateTime start = LocalDate.now().plusDays(1).atStartOfDay();

        try {
            runDefaultPlanScenario(start);
            runPriceForecastScenario(start);
            runCommitmentScenario(start);
            runDailyScenario();
        } catch (Exception e) {
            logger.error("Simulator error", e);
        }

        logger.info("=".repeat(80));
        logger.info("ALL SCENARIOS COMPLETED");
        logger.info("=".repeat(80));
    }

    private void runDefaultPlanScenario(LocalDateTime start) {
        logScenarioHeader("SCENARIO 1: Default Diurnal Plan",
                "Charge 00-06 at 80% LSL, discharge 14-20 at 90% HSL, hold otherwise");

        Map<String, Object> plan = generate(new GeneratePlanRequest(start, 168));
        validate(plan, "Scenario 1");
    }

    private void runPriceForecastScenario(LocalDateTime start) {
        logScenarioHeader("SCENARIO 2: Price-Based Plan",
                "Peak 14-20 $60-120, off-peak 00-06 $10-30, shoulder $30-60");

        GeneratePlanRequest request = new GeneratePlanRequest(start, 168);
        request.priceForecast = syntheticForecast(start, 168);

        Map<String, Object> plan = generate(request);
        validate(plan, "Scenario 2");
    }

    private void runCommitmentScenario(LocalDateTime start) {
        logScenarioHeader("SCENARIO 3: Ancillary Service Awards",
                "Regulation 08:00, RRS 16:00-18:00, ECRS 21:00 on day one");

        GeneratePlanRequest request = new GeneratePlanRequest(start, 168);
        request.asCommitments = List.of(
                new CommitmentEntry(start.plusHours(8), 10.0, 0.0, 0.0),
                new CommitmentEntry(start.plusHours(16), 0.0, 20.0, 0.0),
                new CommitmentEntry(start.plusHours(17), 0.0, 20.0, 0.0),
                new CommitmentEntry(start.plusHours(21), 0.0, 0.0, 15.0));

        Map<String, Object> plan = generate(request);
        validate(plan, "Scenario 3");
    }

    private void runDailyScenario() {
        logScenarioHeader("SCENARIO 4: Daily Run", "Generate, validate, auto-submit disabled");

        try {
            Map<String, Object> result = webClient.post()
                    .uri("/plans/daily-run")
                    .bodyValue(new DailyRunRequest())
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(TIMEOUT)
                    .block();

            Map<?, ?> validation = (Map<?, ?>) result.get("validation");
            Map<?, ?> submission = (Map<?, ?>) result.get("submission");
            logger.info("Daily run: {} | submission {} ({})",
                    validation.get("summary"), submission.get("status"), submission.get("message"));

        } catch (Exception e) {
            logger.error("Daily run failed: {}", e.getMessage());
        }
    }

    private List<PricePoint> syntheticForecast(LocalDateTime start, int hours) {
        List<PricePoint> forecast = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            LocalDateTime hour = start.plusHours(i);
            int hourOfDay = hour.getHour();
            double price;
            if (hourOfDay >= 14 && hourOfDay < 20) {
                price = uniform(60, 120);
            } else if (hourOfDay < 6) {
                price = uniform(10, 30);
            } else {
                price = uniform(30, 60);
            }
            forecast.add(new PricePoint(hour, price));
        }
        return forecast;
    }

    private double uniform(double low, double high) {
        return low + random.nextDouble() * (high - low);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> generate(GeneratePlanRequest request) {
        try {
            Map<String, Object> plan = webClient.post()
                    .uri("/plans/generate")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(TIMEOUT)
                    .block();

            List<?> hours = (List<?>) plan.get("hours");
            logger.info("✓ Generated plan for {}: {} hours", plan.get("resourceName"), hours != null ? hours.size() : 0);
            return plan;

        } catch (Exception e) {
            logger.error("Failed to generate plan: {}", e.getMessage());
            return null;
        }
    }

    private void validate(Map<String, Object> plan, String checkpoint) {
        if (plan == null) {
            logger.warn("{}: no plan to validate", checkpoint);
            return;
        }

        try {
            Map<String, Object> report = webClient.post()
                    .uri("/plans/validate")
                    .bodyValue(plan)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(TIMEOUT)
                    .block();

            logger.info(String.format("📋 %s: %s (%s errors, %s warnings)", checkpoint,
                    report.get("summary"), report.get("errorCount"), report.get("warningCount")));

            List<?> warnings = (List<?>) report.get("warnings");
            if (warnings != null) {
                warnings.stream().limit(3).forEach(w -> logger.info("   ⚠ {}", ((Map<?, ?>) w).get("message")));
            }

        } catch (Exception e) {
            logger.error("Failed to validate plan: {}", e.getMessage());
        }
    }

    private void logScenarioHeader(String title, String setup) {
        logger.info("\n" + "=".repeat(60));
        logger.info(title);
        logger.info("=".repeat(60));
        logger.info("Setup: {}", setup);
        logger.info("-".repeat(60));
    }
}
