package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.client.LiveClient;
import com.phillippitts.streamwatch.client.LiveClientFactory;
import com.phillippitts.streamwatch.client.MediaCapture;
import com.phillippitts.streamwatch.config.roster.MonitorSettings;
import com.phillippitts.streamwatch.config.roster.SettingsSource;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import com.phillippitts.streamwatch.exception.RecordingStartException;
import com.phillippitts.streamwatch.persistence.EventKind;
import com.phillippitts.streamwatch.persistence.SessionSinks;
import com.phillippitts.streamwatch.persistence.SessionSummaryLog;
import com.phillippitts.streamwatch.persistence.SummaryRecord;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.recording.event.AdmissionRejectedEvent;
import com.phillippitts.streamwatch.service.recording.event.RecordingStartedEvent;
import com.phillippitts.streamwatch.service.recording.event.RecordingStoppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link RecordingOrchestrator}.
 *
 * <p><b>Admission:</b> the duplicate and cap checks and the reservation of the session slot happen
 * under one lock, so concurrent starts can never exceed the cap. The slot is reserved by a
 * {@link SessionState#STARTING} session before any I/O and released if bring-up fails.
 *
 * <p><b>Bring-up:</b> open the per-kind sinks, create and connect a {@link LiveClient} with a
 * {@link SessionEventRecorder}, then start media capture. Any failure closes the sinks opened so
 * far, disconnects the client, writes a failed {@code recording_attempt} summary row and returns
 * {@link AdmissionResult#FAILED}.
 *
 * <p><b>Teardown:</b> fence (state leaves RECORDING), stop capture, disconnect with a bounded wait,
 * close sinks once, write the summary row, remove the session. Every step is best-effort; the
 * removal always happens.
 */
public class DefaultRecordingOrchestrator implements RecordingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordingOrchestrator.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final LiveClientFactory clientFactory;
    private final SettingsSource settingsSource;
    private final SessionSinks.SinkFactory sinkFactory;
    private final SessionSummaryLog summaryLog;
    private final ApplicationEventPublisher publisher;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private final Lock admission = new ReentrantLock();
    private final Map<String, RecordingSession> sessions = new ConcurrentHashMap<>();

    public DefaultRecordingOrchestrator(LiveClientFactory clientFactory,
                                        SettingsSource settingsSource,
                                        SessionSinks.SinkFactory sinkFactory,
                                        SessionSummaryLog summaryLog,
                                        ApplicationEventPublisher publisher,
                                        MonitorMetrics metrics,
                                        Clock clock) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource must not be null");
        this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory must not be null");
        this.summaryLog = Objects.requireNonNull(summaryLog, "summaryLog must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics == null ? MonitorMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics.registerActiveSessionsGauge(sessions::size);
    }

    @Override
    public AdmissionResult start(StreamerConfig streamer) {
        MonitorSettings settings = settingsSource.settings();
        String username = streamer.username();
        ThreadContext.put("streamer", username);
        try {
            RecordingSession session;
            admission.lock();
            try {
                if (sessions.containsKey(username)) {
                    return reject(streamer, AdmissionResult.DUPLICATE, "Already recording");
                }
                int cap = settings.maxConcurrentRecordings();
                if (sessions.size() >= cap) {
                    return reject(streamer, AdmissionResult.CAP_REACHED,
                            "Max concurrent recordings (" + cap + ") reached");
                }
                Instant now = clock.instant();
                session = new RecordingSession(streamer, baseName(username, now), now);
                sessions.put(username, session);
            } finally {
                admission.unlock();
            }

            try {
                bringUp(session, settings);
            } catch (RecordingStartException e) {
                session.abortStart();
                session.markStopped();
                sessions.remove(username, session);
                LOG.error(e.getMessage());
                return reject(streamer, AdmissionResult.FAILED, e.getMessage());
            }

            boolean active = session.activate();
            metrics.incrementSessionStarted();
            summaryLog.append(new SummaryRecord(session.startedAt(), username, SummaryRecord.ACTION_STARTED,
                    SummaryRecord.SUCCESS, 0.0, Map.of(), streamer.tags(), streamer.notes(), ""));
            LOG.info("Started recording {} to {}", username, session.mediaFile());
            publisher.publishEvent(new RecordingStartedEvent(username, session.startedAt(), session.mediaFile()));

            if (!active) {
                StopReason reason = session.deferredStop();
                LOG.info("Stop ({}) requested for {} while starting; stopping now", reason, username);
                session.abortStart();
                teardown(session, reason);
            }
            return AdmissionResult.STARTED;
        } finally {
            ThreadContext.remove("streamer");
        }
    }

    private void bringUp(RecordingSession session, MonitorSettings settings) {
        String username = session.username();
        Path outputDir = settings.outputPath();
        SessionSinks sinks;
        try {
            sinks = SessionSinks.open(outputDir, session.baseName(), sinkFactory);
        } catch (IOException | RuntimeException e) {
            throw new RecordingStartException(username, "sinks", e);
        }
        session.attachSinks(sinks);

        String stage = "client";
        LiveClient client = null;
        try {
            client = clientFactory.create(username, session.streamer().credentials(settings));
            session.attachClient(client);
            stage = "connect";
            client.connect(new SessionEventRecorder(session, publisher, metrics, clock));
            stage = "capture";
            Path media = outputDir.resolve(session.baseName() + ".mp4");
            client.mediaCapture().start(media);
            session.attachMedia(media);
        } catch (RuntimeException e) {
            sinks.closeAll();
            if (client != null) {
                disconnect(client, username, settings.disconnectTimeout());
            }
            throw new RecordingStartException(username, stage, e);
        }
    }

    private AdmissionResult reject(StreamerConfig streamer, AdmissionResult result, String message) {
        String username = streamer.username();
        if (result != AdmissionResult.FAILED) {
            LOG.warn("Cannot start recording for {}: {}", username, message);
        }
        metrics.incrementAdmissionRejected(result.tag());
        Instant now = clock.instant();
        summaryLog.append(new SummaryRecord(now, username, SummaryRecord.ACTION_ATTEMPT, SummaryRecord.FAILED,
                0.0, Map.of(), streamer.tags(), streamer.notes(), message));
        publisher.publishEvent(new AdmissionRejectedEvent(username, now, result, message));
        return result;
    }

    @Override
    public boolean stop(String username, StopReason reason) {
        RecordingSession session = sessions.get(username);
        if (session == null) {
            LOG.warn("No active recording for {} (stop reason: {})", username, reason);
            return false;
        }
        switch (session.requestStop(reason)) {
            case PROCEED:
                ThreadContext.put("streamer", username);
                try {
                    teardown(session, reason);
                } finally {
                    ThreadContext.remove("streamer");
                }
                return true;
            case DEFERRED:
                LOG.info("Recording for {} is still starting; stop ({}) deferred", username, reason);
                return true;
            default:
                LOG.warn("Recording for {} is already stopping; ignoring stop ({})", username, reason);
                return false;
        }
    }

    private void teardown(RecordingSession session, StopReason reason) {
        String username = session.username();
        MonitorSettings settings = settingsSource.settings();
        LOG.info("Stopping recording for {} - reason: {}", username, reason);
        try {
            session.awaitReconnect();
            LiveClient client = session.client();
            if (client != null) {
                stopCapture(client.mediaCapture(), username);
                disconnect(client, username, settings.disconnectTimeout());
            }
            SessionSinks sinks = session.sinks();
            if (sinks != null) {
                sinks.closeAll();
            }
        } finally {
            session.markStopped();
            sessions.remove(username, session);
            Instant now = clock.instant();
            Duration duration = Duration.between(session.startedAt(), now);
            Map<EventKind, Long> counts = session.counts();
            StreamerConfig streamer = session.streamer();
            summaryLog.append(new SummaryRecord(now, username,
                    SummaryRecord.ACTION_STOPPED_PREFIX + reason.actionSuffix(), SummaryRecord.SUCCESS,
                    duration.toMillis() / 60_000.0, counts, streamer.tags(), streamer.notes(), ""));
            metrics.recordSessionStopped(reason.actionSuffix(), duration);
            LOG.info("Session summary for {}: duration={}s, comments={}, gifts={}, follows={}, shares={}, "
                            + "joins={}, likes={}", username, duration.toSeconds(),
                    counts.get(EventKind.CHAT), counts.get(EventKind.GIFT), counts.get(EventKind.FOLLOW),
                    counts.get(EventKind.SHARE), counts.get(EventKind.JOIN), counts.get(EventKind.LIKE));
            publisher.publishEvent(new RecordingStoppedEvent(username, now, reason, duration, counts));
        }
    }

    private static void stopCapture(MediaCapture capture, String username) {
        if (capture == null) {
            return;
        }
        try {
            if (capture.isCapturing()) {
                capture.stop();
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop media capture for {}: {}", username, e.toString());
        }
    }

    private static void disconnect(LiveClient client, String username, Duration timeout) {
        try {
            client.disconnect().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Disconnect from {} did not complete within {} ms", username, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while disconnecting from {}", username);
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            LOG.warn("Error disconnecting from {}: {}", username, cause.toString());
        }
    }

    @Override
    public void stopAll(StopReason reason) {
        List<String> usernames = activeUsernames();
        if (!usernames.isEmpty()) {
            LOG.info("Stopping {} active recording(s): {}", usernames.size(), reason);
        }
        for (String username : usernames) {
            stop(username, reason);
        }
    }

    @Override
    public boolean reconnect(String username) {
        RecordingSession session = sessions.get(username);
        if (session == null || !session.beginReconnect()) {
            return false;
        }
        try {
            LiveClient client = session.client();
            if (client.isConnected()) {
                return true;
            }
            int attempt = session.nextReconnect();
            LOG.info("Reconnecting to {} (attempt {})", username, attempt);
            client.connect(new SessionEventRecorder(session, publisher, metrics, clock));
            if (!session.isRecording()) {
                LOG.info("Recording for {} stopped during reconnect; dropping the new connection", username);
                disconnect(client, username, settingsSource.settings().disconnectTimeout());
                return false;
            }
            MediaCapture capture = client.mediaCapture();
            if (!capture.isCapturing()) {
                Path media = settingsSource.settings().outputPath()
                        .resolve(session.baseName() + "_part" + (attempt + 1) + ".mp4");
                capture.start(media);
                session.attachMedia(media);
            }
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Reconnect to {} failed: {}", username, e.toString());
            return false;
        } finally {
            session.endReconnect();
        }
    }

    @Override
    public boolean isRecording(String username) {
        return sessions.containsKey(username);
    }

    @Override
    public Optional<RecordingSession> session(String username) {
        return Optional.ofNullable(sessions.get(username));
    }

    @Override
    public int activeCount() {
        return sessions.size();
    }

    @Override
    public List<String> activeUsernames() {
        List<String> names = new ArrayList<>(sessions.keySet());
        names.sort(null);
        return names;
    }

    private String baseName(String username, Instant at) {
        String stamp = LocalDateTime.ofInstant(at, clock.getZone()).format(FILE_STAMP);
        return username.replace("@", "") + "_" + stamp;
    }
}
