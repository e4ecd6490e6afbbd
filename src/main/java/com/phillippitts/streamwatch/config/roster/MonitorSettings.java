package com.phillippitts.streamwatch.config.roster;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings block of the roster file.
 *
 * <p>Missing values take the documented defaults in the compact constructor, so a partial
 * settings block is always complete after deserialization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MonitorSettings(
        @JsonProperty("check_interval_seconds")
        @Positive(message = "check_interval_seconds must be positive")
        Integer checkIntervalSeconds,

        @JsonProperty("max_concurrent_recordings")
        @Positive(message = "max_concurrent_recordings must be positive")
        Integer maxConcurrentRecordings,

        @JsonProperty("output_directory")
        @NotBlank(message = "output_directory must not be blank")
        String outputDirectory,

        @JsonProperty("credential") @JsonAlias("session_id")
        String credential,

        @JsonProperty("region") @JsonAlias("tt_target_idc")
        String region,

        @JsonProperty("stability_threshold")
        @Positive(message = "stability_threshold must be positive")
        Integer stabilityThreshold,

        @JsonProperty("cooldown_seconds")
        @PositiveOrZero(message = "cooldown_seconds must not be negative")
        Integer cooldownSeconds,

        @JsonProperty("disconnect_grace_seconds")
        @PositiveOrZero(message = "disconnect_grace_seconds must not be negative")
        Integer disconnectGraceSeconds,

        @JsonProperty("probe_timeout_seconds")
        @Positive(message = "probe_timeout_seconds must be positive")
        Integer probeTimeoutSeconds,

        @JsonProperty("probe_retries")
        @PositiveOrZero(message = "probe_retries must not be negative")
        Integer probeRetries,

        @JsonProperty("probe_backoff_millis")
        @PositiveOrZero(message = "probe_backoff_millis must not be negative")
        Long probeBackoffMillis,

        @JsonProperty("poll_deadline_seconds")
        @Positive(message = "poll_deadline_seconds must be positive")
        Integer pollDeadlineSeconds,

        @JsonProperty("stability_window_seconds")
        @Positive(message = "stability_window_seconds must be positive")
        Integer stabilityWindowSeconds,

        @JsonProperty("disconnect_timeout_seconds")
        @Positive(message = "disconnect_timeout_seconds must be positive")
        Integer disconnectTimeoutSeconds,

        @JsonProperty("status_every_cycles")
        @Positive(message = "status_every_cycles must be positive")
        Integer statusEveryCycles
) {
    public static final String DEFAULT_REGION = "us-eastred";

    public MonitorSettings {
        checkIntervalSeconds = orDefault(checkIntervalSeconds, 30);
        maxConcurrentRecordings = orDefault(maxConcurrentRecordings, 3);
        outputDirectory = outputDirectory == null ? "recordings" : outputDirectory;
        region = region == null ? DEFAULT_REGION : region;
        stabilityThreshold = orDefault(stabilityThreshold, 3);
        cooldownSeconds = orDefault(cooldownSeconds, 90);
        disconnectGraceSeconds = orDefault(disconnectGraceSeconds, 30);
        probeTimeoutSeconds = orDefault(probeTimeoutSeconds, 10);
        probeRetries = orDefault(probeRetries, 2);
        probeBackoffMillis = probeBackoffMillis == null ? 1000L : probeBackoffMillis;
        pollDeadlineSeconds = orDefault(pollDeadlineSeconds, 30);
        stabilityWindowSeconds = orDefault(stabilityWindowSeconds, 300);
        disconnectTimeoutSeconds = orDefault(disconnectTimeoutSeconds, 10);
        statusEveryCycles = orDefault(statusEveryCycles, 5);
    }

    /**
     * @return settings with every value at its default
     */
    public static MonitorSettings defaults() {
        return new MonitorSettings(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public Duration checkInterval() {
        return Duration.ofSeconds(checkIntervalSeconds);
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public Duration disconnectGrace() {
        return Duration.ofSeconds(disconnectGraceSeconds);
    }

    public Duration probeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    public Duration probeBackoff() {
        return Duration.ofMillis(probeBackoffMillis);
    }

    public Duration pollDeadline() {
        return Duration.ofSeconds(pollDeadlineSeconds);
    }

    public Duration stabilityWindow() {
        return Duration.ofSeconds(stabilityWindowSeconds);
    }

    public Duration disconnectTimeout() {
        return Duration.ofSeconds(disconnectTimeoutSeconds);
    }

    public Path outputPath() {
        return Path.of(outputDirectory);
    }

    /**
     * Returns a copy with the given command-line overrides applied; {@code null} override values
     * leave the file value in place.
     */
    public MonitorSettings withOverrides(CommandLineOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        return new MonitorSettings(
                overrides.checkIntervalSeconds() != null ? overrides.checkIntervalSeconds() : checkIntervalSeconds,
                maxConcurrentRecordings,
                overrides.outputDirectory() != null ? overrides.outputDirectory() : outputDirectory,
                overrides.credential() != null ? overrides.credential() : credential,
                overrides.region() != null ? overrides.region() : region,
                stabilityThreshold,
                cooldownSeconds,
                disconnectGraceSeconds,
                probeTimeoutSeconds,
                probeRetries,
                probeBackoffMillis,
                pollDeadlineSeconds,
                stabilityWindowSeconds,
                disconnectTimeoutSeconds,
                statusEveryCycles);
    }

    private static Integer orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
