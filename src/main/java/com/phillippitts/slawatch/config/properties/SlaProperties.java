package com.phillippitts.slawatch.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SLA thresholds per support channel.
 */
@ConfigurationProperties(prefix = "slawatch.sla")
@Validated
public class SlaProperties {

    /** Threshold applied to channels without an explicit override. */
    @NotNull
    private Duration defaultThreshold = Duration.ofSeconds(5);

    /** Per-channel overrides, e.g. {@code slawatch.sla.thresholds.email=60s}. */
    private Map<String, Duration> thresholds = new HashMap<>();

    /** Known channels; measurements for any other channel are recorded as "other". */
    @NotEmpty
    private List<String> channels = new ArrayList<>(List.of("chat", "voice", "email"));

    public Duration getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(Duration defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public Map<String, Duration> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, Duration> thresholds) {
        this.thresholds = thresholds;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels;
    }

    /**
     * Returns the threshold configured for a channel, falling back to the default.
     */
    public Duration thresholdFor(String channel) {
        return thresholds.getOrDefault(channel, defaultThreshold);
    }
}
