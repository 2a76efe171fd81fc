package com.example.Battery_Operating_Plan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Market operator submission settings
 *
 * Test mode is on by default: plans are formatted and sized but never sent.
 */
@Configuration
@ConfigurationProperties(prefix = "cop.submission")
public class SubmissionProperties {

    private String endpoint = "https://api.ercot.com/cop/submit";

    /** Bearer token for the submission endpoint, injected from the environment */
    private String apiKey;

    /** Qualified Scheduling Entity submitting on behalf of the resource */
    private String qseName = "TEST_QSE";

    private boolean testMode = true;

    private int timeoutSeconds = 30;

    /** Latest local time of day a COP may be submitted */
    private LocalTime dailyCutoff = LocalTime.of(14, 30);

    private ZoneId marketZone = ZoneId.of("America/Chicago");

    /** Submission history entries kept in memory; the oldest are dropped first */
    private int historySize = 500;

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getQseName() { return qseName; }
    public void setQseName(String qseName) { this.qseName = qseName; }

    public boolean isTestMode() { return testMode; }
    public void setTestMode(boolean testMode) { this.testMode = testMode; }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public LocalTime getDailyCutoff() { return dailyCutoff; }
    public void setDailyCutoff(LocalTime dailyCutoff) { this.dailyCutoff = dailyCutoff; }

    public ZoneId getMarketZone() { return marketZone; }
    public void setMarketZone(ZoneId marketZone) { this.marketZone = marketZone; }

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
}
