package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.client.Credentials;
import com.phillippitts.streamwatch.client.LiveClient;
import com.phillippitts.streamwatch.client.LiveClientFactory;
import com.phillippitts.streamwatch.config.roster.MonitorSettings;
import com.phillippitts.streamwatch.config.roster.SettingsSource;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import com.phillippitts.streamwatch.exception.ProbeException;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link LivenessProber} that asks a fresh {@link LiveClient} per attempt, bounding each attempt by
 * the configured probe timeout and retrying with linearly growing backoff.
 *
 * <p><b>Retry policy:</b> {@code probe_retries + 1} attempts in total. Between attempt {@code n}
 * and {@code n + 1} the prober sleeps {@code probe_backoff_millis * n}. Timeouts, transport errors
 * and null answers all count as failed attempts. When every attempt fails the streamer is reported
 * offline; the failure is logged at DEBUG and counted, never thrown.
 *
 * <p><b>Interruption:</b> an interrupt aborts remaining attempts, restores the interrupt flag and
 * reports offline.
 */
public class RetryingLivenessProber implements LivenessProber {

    private static final Logger LOG = LogManager.getLogger(RetryingLivenessProber.class);

    private final LiveClientFactory clientFactory;
    private final SettingsSource settingsSource;
    private final MonitorMetrics metrics;

    public RetryingLivenessProber(LiveClientFactory clientFactory,
                                  SettingsSource settingsSource,
                                  MonitorMetrics metrics) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
        this.metrics = metrics == null ? MonitorMetrics.NOOP : metrics;
    }

    @Override
    public boolean isLive(StreamerConfig streamer) {
        MonitorSettings settings = settingsSource.settings();
        Credentials credentials = streamer.credentials(settings);
        int attempts = settings.probeRetries() + 1;
        ProbeException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                boolean live = probeOnce(streamer.username(), credentials, settings.probeTimeout(), attempt);
                metrics.recordProbe(live ? "live" : "offline");
                return live;
            } catch (ProbeException e) {
                last = e;
                LOG.debug(e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Probe for {} interrupted", streamer.username());
                metrics.recordProbe("failed");
                return false;
            }
            if (attempt < attempts && !backoff(settings.probeBackoff().multipliedBy(attempt))) {
                break;
            }
        }

        metrics.recordProbe("failed");
        LOG.debug("Probe for {} failed after {} attempt(s), treating as offline: {}",
                streamer.username(), attempts, last == null ? "interrupted" : last.getMessage());
        return false;
    }

    private boolean probeOnce(String username, Credentials credentials, Duration timeout, int attempt)
            throws InterruptedException {
        CompletableFuture<Boolean> answer;
        try {
            LiveClient client = clientFactory.create(username, credentials);
            answer = client.isLive();
        } catch (RuntimeException e) {
            throw new ProbeException(username, attempt, e.toString(), e);
        }
        if (answer == null) {
            throw new ProbeException(username, attempt, "client returned no answer", null);
        }
        try {
            Boolean live = answer.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (live == null) {
                throw new ProbeException(username, attempt, "malformed response (null)", null);
            }
            return live;
        } catch (TimeoutException e) {
            answer.cancel(true);
            throw new ProbeException(username, attempt, "timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ProbeException(username, attempt, cause.toString(), cause);
        }
    }

    /** Returns false when interrupted. */
    private boolean backoff(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
