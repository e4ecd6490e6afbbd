package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.config.roster.SettingsSource;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans the {@link LivenessProber} out over the whole roster once per poll cycle.
 *
 * <p>Each streamer is probed on {@code probeExecutor} independently. The call waits for all probes
 * up to {@code poll_deadline_seconds}; streamers whose probe has not completed by then are
 * reported as not live and their probes are cancelled best-effort. One streamer's failure or
 * slowness never removes or delays another streamer's result.
 */
public class ParallelPollEngine {

    private static final Logger LOG = LogManager.getLogger(ParallelPollEngine.class);

    private final LivenessProber prober;
    private final Executor executor;
    private final SettingsSource settingsSource;

    public ParallelPollEngine(LivenessProber prober, Executor executor, SettingsSource settingsSource) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
    }

    /**
     * Probes every streamer in {@code roster} concurrently.
     *
     * @param roster enabled streamers
     * @return live status keyed by username, with an entry for every streamer in the roster
     */
    public Map<String, Boolean> pollAll(List<StreamerConfig> roster) {
        Map<String, Boolean> snapshot = new LinkedHashMap<>();
        if (roster.isEmpty()) {
            return snapshot;
        }
        Duration deadline = settingsSource.settings().pollDeadline();

        Map<String, CompletableFuture<Boolean>> futures = new LinkedHashMap<>();
        for (StreamerConfig streamer : roster) {
            snapshot.put(streamer.username(), Boolean.FALSE);
            futures.put(streamer.username(), CompletableFuture.supplyAsync(() -> probe(streamer), executor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            long pending = futures.values().stream().filter(f -> !f.isDone()).count();
            LOG.warn("Parallel streamer check timed out after {} ms; {} of {} checks incomplete",
                    deadline.toMillis(), pending, futures.size());
            futures.values().forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.values().forEach(f -> f.cancel(true));
        } catch (ExecutionException ee) {
            // Individual failures are collected per streamer below
            LOG.debug("Exception in parallel check: {}", ee.getCause() == null ? ee : ee.getCause().toString());
        }

        futures.forEach((username, future) -> snapshot.put(username, resultOrOffline(future)));
        return snapshot;
    }

    private boolean probe(StreamerConfig streamer) {
        ThreadContext.put("streamer", streamer.username());
        try {
            return prober.isLive(streamer);
        } catch (RuntimeException e) {
            LOG.debug("Error in parallel check for {}: {}", streamer.username(), e.toString());
            return false;
        } finally {
            ThreadContext.remove("streamer");
        }
    }

    private static boolean resultOrOffline(CompletableFuture<Boolean> f) {
        if (!f.isDone() || f.isCompletedExceptionally() || f.isCancelled()) {
            return false;
        }
        return Boolean.TRUE.equals(f.getNow(Boolean.FALSE));
    }
}
