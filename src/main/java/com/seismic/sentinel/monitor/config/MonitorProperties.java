package com.seismic.sentinel.monitor.config;

import com.seismic.sentinel.monitor.enums.MagnitudeBucket;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pipeline configuration. Validated at startup; an invalid value keeps the application from starting.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties("monitor")
public class MonitorProperties {

    @NotBlank(message = "monitor.feed-url is required")
    private String feedUrl;

    private boolean enabled = true;

    @Min(1)
    private int pollIntervalSeconds = 60;

    @Min(0)
    private int initialDelaySeconds = 0;

    @Min(1)
    private long retentionWindowSeconds = 86_400;

    @Min(1)
    private int fetchTimeoutSeconds = 10;

    @DecimalMin("0.0")
    private double clusterRadiusKm = 25.0;

    @Min(0)
    private long clusterWindowSeconds = 21_600;

    /** Lower bounds of LIGHT, MODERATE, STRONG and MAJOR. */
    @NotNull
    private List<Double> magnitudeThresholds = new ArrayList<>(Arrays.asList(4.0, 5.0, 6.0, 7.0));

    @Valid
    @NotNull
    private Rules rules = new Rules();

    @AssertTrue(message = "monitor.feed-url must be an absolute http or https URL")
    public boolean isFeedUrlValid() {
        // blank is reported by @NotBlank
        if (feedUrl == null || feedUrl.isBlank()) return true;
        try {
            URI uri = new URI(feedUrl);
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @AssertTrue(message = "monitor.magnitude-thresholds must hold 4 strictly ascending numbers")
    public boolean isMagnitudeThresholdsValid() {
        if (magnitudeThresholds == null || magnitudeThresholds.size() != MagnitudeBucket.BREAKPOINTS) return false;
        for (int i = 0; i < magnitudeThresholds.size(); i++) {
            Double v = magnitudeThresholds.get(i);
            if (v == null || v.isNaN() || v.isInfinite()) return false;
            if (i > 0 && v <= magnitudeThresholds.get(i - 1)) return false;
        }
        return true;
    }

    public Duration getPollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    public Duration getRetentionWindow() {
        return Duration.ofSeconds(retentionWindowSeconds);
    }

    public Duration getFetchTimeout() {
        return Duration.ofSeconds(fetchTimeoutSeconds);
    }

    public Duration getClusterWindow() {
        return Duration.ofSeconds(clusterWindowSeconds);
    }

    public double thresholdOf(MagnitudeBucket bucket) {
        return bucket.lowerBound(magnitudeThresholds);
    }

    @Getter
    @Setter
    public static class Rules {
        @Min(2)
        private int clusterMinEvents = 2;
        @Min(1)
        private int clusterMinAboveModerate = 1;
        private double significantMagnitude = 5.0;
        @DecimalMin("0.0")
        private double surgeRatePerHour = 30.0;
    }
}
