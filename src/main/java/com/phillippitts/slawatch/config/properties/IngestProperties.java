package com.phillippitts.slawatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the remote ingestion backend.
 *
 * <p>Credentials come from the environment ({@code AXIOM_TOKEN}, {@code AXIOM_ORG_ID}) via
 * placeholders in application.properties.
 */
@ConfigurationProperties(prefix = "slawatch.ingest")
@Validated
public class IngestProperties {

    @NotBlank
    private String baseUrl = "https://api.axiom.co";

    @NotBlank
    private String dataset = "chatbot-monitoring";

    private String token = "";

    private String orgId = "";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    /** Probe the backend once when the application is ready and log the result. */
    private boolean verifyOnStartup = true;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDataset() {
        return dataset;
    }

    public void setDataset(String dataset) {
        this.dataset = dataset;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getOrgId() {
        return orgId;
    }

    public void setOrgId(String orgId) {
        this.orgId = orgId;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public boolean isVerifyOnStartup() {
        return verifyOnStartup;
    }

    public void setVerifyOnStartup(boolean verifyOnStartup) {
        this.verifyOnStartup = verifyOnStartup;
    }
}
