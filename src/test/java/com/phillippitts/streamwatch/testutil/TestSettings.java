package com.phillippitts.streamwatch.testutil;

import com.phillippitts.streamwatch.config.roster.MonitorSettings;
import com.phillippitts.streamwatch.config.roster.SettingsSource;

/**
 * Mutable settings holder for tests. Values left untouched keep the production defaults, except
 * the probe backoff which defaults to zero to keep tests fast.
 */
public class TestSettings implements SettingsSource {

    public int checkIntervalSeconds = 30;
    public int maxConcurrentRecordings = 3;
    public String outputDirectory = "recordings";
    public String credential;
    public String region = MonitorSettings.DEFAULT_REGION;
    public int stabilityThreshold = 3;
    public int cooldownSeconds = 90;
    public int disconnectGraceSeconds = 30;
    public int probeTimeoutSeconds = 10;
    public int probeRetries = 2;
    public long probeBackoffMillis = 0;
    public int pollDeadlineSeconds = 30;
    public int stabilityWindowSeconds = 300;
    public int disconnectTimeoutSeconds = 1;
    public int statusEveryCycles = 5;

    public MonitorSettings build() {
        return new MonitorSettings(checkIntervalSeconds, maxConcurrentRecordings, outputDirectory, credential,
                region, stabilityThreshold, cooldownSeconds, disconnectGraceSeconds, probeTimeoutSeconds,
                probeRetries, probeBackoffMillis, pollDeadlineSeconds, stabilityWindowSeconds,
                disconnectTimeoutSeconds, statusEveryCycles);
    }

    @Override
    public MonitorSettings settings() {
        return build();
    }
}
