package com.phillippitts.streamwatch.service.recording;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.phillippitts.streamwatch.client.event.CommentEvent;
import com.phillippitts.streamwatch.client.event.LiveUser;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import com.phillippitts.streamwatch.persistence.EventKind;
import com.phillippitts.streamwatch.persistence.SessionSummaryLog;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.recording.event.AdmissionRejectedEvent;
import com.phillippitts.streamwatch.service.recording.event.RecordingStartedEvent;
import com.phillippitts.streamwatch.service.recording.event.RecordingStoppedEvent;
import com.phillippitts.streamwatch.testutil.EventCapturingPublisher;
import com.phillippitts.streamwatch.testutil.FakeLiveClient;
import com.phillippitts.streamwatch.testutil.FakeLiveClientFactory;
import com.phillippitts.streamwatch.testutil.InMemorySinkFactory;
import com.phillippitts.streamwatch.testutil.MutableClock;
import com.phillippitts.streamwatch.testutil.TestSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DefaultRecordingOrchestratorTest {

    @TempDir
    Path tempDir;

    private TestSettings settings;
    private FakeLiveClientFactory clients;
    private InMemorySinkFactory sinks;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private SessionSummaryLog summaryLog;
    private SimpleMeterRegistry registry;
    private DefaultRecordingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        settings = new TestSettings();
        settings.outputDirectory = tempDir.resolve("recordings").toString();
        clients = new FakeLiveClientFactory();
        sinks = new InMemorySinkFactory();
        publisher = new EventCapturingPublisher();
        clock = MutableClock.atEpoch();
        summaryLog = new SessionSummaryLog(tempDir.resolve("logs"), new CsvMapper(), clock);
        registry = new SimpleMeterRegistry();
        orchestrator = new DefaultRecordingOrchestrator(clients, settings, sinks, summaryLog, publisher,
                new MonitorMetrics(registry), clock);
    }

    private List<String> summaryLines() throws IOException {
        return Files.readAllLines(summaryLog.currentFile());
    }

    @Test
    void shouldStartSessionWithSinksClientAndCapture() {
        AdmissionResult result = orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(result).isEqualTo(AdmissionResult.STARTED);
        assertThat(orchestrator.isRecording("@alice")).isTrue();
        assertThat(orchestrator.activeCount()).isEqualTo(1);
        assertThat(sinks.opened).hasSize(EventKind.values().length);
        assertThat(sinks.last(EventKind.CHAT).path.getFileName().toString())
                .isEqualTo("alice_20250701_075347_comments.csv");

        FakeLiveClient client = clients.sessionClient("@alice");
        assertThat(client.capture().isCapturing()).isTrue();
        assertThat(client.capture().outputPath())
                .isEqualTo(tempDir.resolve("recordings").resolve("alice_20250701_075347.mp4"));

        RecordingStartedEvent started = publisher.first(RecordingStartedEvent.class);
        assertThat(started.username()).isEqualTo("@alice");
        assertThat(orchestrator.session("@alice").orElseThrow().state()).isEqualTo(SessionState.RECORDING);
    }

    @Test
    void shouldRejectDuplicateStart() {
        orchestrator.start(StreamerConfig.of("@alice"));

        AdmissionResult second = orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(second).isEqualTo(AdmissionResult.DUPLICATE);
        assertThat(orchestrator.activeCount()).isEqualTo(1);
        assertThat(clients.created).hasSize(1);
    }

    @Test
    void shouldRejectStartBeyondCapAndLogIt() throws IOException {
        settings.maxConcurrentRecordings = 2;

        orchestrator.start(StreamerConfig.of("@a"));
        orchestrator.start(StreamerConfig.of("@b"));
        AdmissionResult third = orchestrator.start(StreamerConfig.of("@c"));

        assertThat(third).isEqualTo(AdmissionResult.CAP_REACHED);
        assertThat(orchestrator.activeUsernames()).containsExactly("@a", "@b");
        AdmissionRejectedEvent rejected = publisher.first(AdmissionRejectedEvent.class);
        assertThat(rejected.username()).isEqualTo("@c");
        assertThat(rejected.result()).isEqualTo(AdmissionResult.CAP_REACHED);
        assertThat(summaryLines()).anySatisfy(line -> assertThat(line)
                .contains("@c,recording_attempt,failed")
                .contains("Max concurrent recordings (2) reached"));
        assertThat(registry.get("streamwatch.admission.rejected").tag("reason", "cap").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void concurrentStartsNeverExceedCap() throws Exception {
        settings.maxConcurrentRecordings = 3;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AdmissionResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 10; i++) {
                String name = "@user" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    return orchestrator.start(StreamerConfig.of(name));
                }));
            }
            go.countDown();
            long started = 0;
            for (Future<AdmissionResult> f : results) {
                if (f.get(10, TimeUnit.SECONDS).isStarted()) {
                    started++;
                }
            }
            assertThat(started).isEqualTo(3);
            assertThat(orchestrator.activeCount()).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRollBackWhenASinkCannotBeOpened() throws IOException {
        sinks.failOn = EventKind.SHARE;

        AdmissionResult result = orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(result).isEqualTo(AdmissionResult.FAILED);
        assertThat(orchestrator.isRecording("@alice")).isFalse();
        assertThat(sinks.opened).isNotEmpty().allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));
        assertThat(clients.created).isEmpty();
        assertThat(summaryLines()).anySatisfy(line -> assertThat(line).contains("@alice,recording_attempt,failed"));
    }

    @Test
    void shouldRollBackWhenConnectFails() {
        clients.failingConnects.add("@alice");

        AdmissionResult result = orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(result).isEqualTo(AdmissionResult.FAILED);
        assertThat(sinks.opened).allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));
        assertThat(clients.created.get(0).disconnectCount).isEqualTo(1);
        assertThat(orchestrator.activeCount()).isZero();
    }

    @Test
    void shouldRollBackWhenCaptureFails() {
        clients.failingCaptures.add("@alice");

        AdmissionResult result = orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(result).isEqualTo(AdmissionResult.FAILED);
        FakeLiveClient client = clients.sessionClient("@alice");
        assertThat(client.disconnectCount).isEqualTo(1);
        assertThat(client.isConnected()).isFalse();
        assertThat(sinks.opened).allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));
        assertThat(publisher.first(AdmissionRejectedEvent.class).result()).isEqualTo(AdmissionResult.FAILED);
    }

    @Test
    void failedStartFreesTheSlot() {
        settings.maxConcurrentRecordings = 1;
        clients.failingConnects.add("@alice");
        orchestrator.start(StreamerConfig.of("@alice"));

        assertThat(orchestrator.start(StreamerConfig.of("@bob"))).isEqualTo(AdmissionResult.STARTED);
    }

    @Test
    void shouldStopSessionAndReleaseResourcesOnce() throws IOException {
        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        clock.advanceSeconds(150);

        boolean first = orchestrator.stop("@alice", StopReason.DISCONNECT_CONFIRMED);
        boolean second = orchestrator.stop("@alice", StopReason.OFFICIAL_END);

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(orchestrator.isRecording("@alice")).isFalse();
        assertThat(client.capture().stopCount).isEqualTo(1);
        assertThat(client.disconnectCount).isEqualTo(1);
        assertThat(sinks.opened).allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));

        RecordingStoppedEvent stopped = publisher.first(RecordingStoppedEvent.class);
        assertThat(stopped.reason()).isEqualTo(StopReason.DISCONNECT_CONFIRMED);
        assertThat(stopped.duration().toSeconds()).isEqualTo(150);
        assertThat(publisher.eventsOf(RecordingStoppedEvent.class)).hasSize(1);
        assertThat(summaryLines()).anySatisfy(line -> assertThat(line)
                .contains("@alice,recording_stopped_disconnect_confirmed,success,2.5"));
    }

    @Test
    void stopOfUnknownStreamerReturnsFalse() {
        assertThat(orchestrator.stop("@nobody", StopReason.MANUAL)).isFalse();
    }

    @Test
    void eventsAfterStopAreNotWritten() {
        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        LiveUser viewer = new LiveUser("viewer1", "Viewer", 10);

        client.emit(new CommentEvent(Instant.now(), viewer, "hello"));
        orchestrator.stop("@alice", StopReason.MANUAL);
        client.emit(new CommentEvent(Instant.now(), viewer, "too late"));

        assertThat(sinks.last(EventKind.CHAT).rows).hasSize(1);
        assertThat(publisher.first(RecordingStoppedEvent.class).counts()).containsEntry(EventKind.CHAT, 1L);
    }

    @Test
    void hangingDisconnectDoesNotBlockTeardown() {
        orchestrator.start(StreamerConfig.of("@alice"));
        clients.hangingDisconnects = true;

        long start = System.nanoTime();
        orchestrator.stop("@alice", StopReason.SHUTDOWN);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(orchestrator.isRecording("@alice")).isFalse();
        assertThat(elapsedMs).isLessThan(5_000L);
        assertThat(sinks.opened).allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));
    }

    @Test
    void stopRequestedWhileStartingIsAppliedAfterStartCompletes() {
        AtomicReference<DefaultRecordingOrchestrator> ref = new AtomicReference<>();
        InMemorySinkFactory inner = new InMemorySinkFactory();
        DefaultRecordingOrchestrator racing = new DefaultRecordingOrchestrator(clients, settings,
                (file, kind) -> {
                    if (kind == EventKind.CHAT) {
                        // Arrives while the session is still STARTING
                        assertThat(ref.get().stop("@alice", StopReason.OFFICIAL_END)).isTrue();
                    }
                    return inner.open(file, kind);
                }, summaryLog, publisher, MonitorMetrics.NOOP, clock);
        ref.set(racing);

        AdmissionResult result = racing.start(StreamerConfig.of("@alice"));

        assertThat(result).isEqualTo(AdmissionResult.STARTED);
        assertThat(racing.isRecording("@alice")).isFalse();
        assertThat(publisher.first(RecordingStoppedEvent.class).reason()).isEqualTo(StopReason.OFFICIAL_END);
        assertThat(inner.opened).allSatisfy(s -> assertThat(s.closeCount).isEqualTo(1));
    }

    @Test
    void stopAllStopsEverySession() {
        orchestrator.start(StreamerConfig.of("@a"));
        orchestrator.start(StreamerConfig.of("@b"));

        orchestrator.stopAll(StopReason.SHUTDOWN);

        assertThat(orchestrator.activeCount()).isZero();
        assertThat(publisher.eventsOf(RecordingStoppedEvent.class))
                .extracting(RecordingStoppedEvent::reason)
                .containsOnly(StopReason.SHUTDOWN);
    }

    @Test
    void reconnectResumesCaptureIntoNewPart() {
        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        client.drop("network");
        client.capture().stop();

        boolean reconnected = orchestrator.reconnect("@alice");

        assertThat(reconnected).isTrue();
        assertThat(client.connectCount).isEqualTo(2);
        assertThat(client.capture().outputPath().getFileName().toString())
                .isEqualTo("alice_20250701_075347_part2.mp4");
    }

    @Test
    void reconnectFailsForUnknownSessionOrRefusedConnect() {
        assertThat(orchestrator.reconnect("@nobody")).isFalse();

        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        client.drop("network");
        clients.failingConnects.add("@alice");

        assertThat(orchestrator.reconnect("@alice")).isFalse();
        assertThat(orchestrator.isRecording("@alice")).isTrue();
    }

    @Test
    void stopDuringReconnectLeavesNoConnectionOrCaptureBehind() throws Exception {
        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        RecordingSession session = orchestrator.session("@alice").orElseThrow();
        client.drop("network");
        client.capture().stop();
        ExecutorService stopper = Executors.newSingleThreadExecutor();
        List<Future<Boolean>> stops = new ArrayList<>();
        client.onConnect = () -> {
            stops.add(stopper.submit(() -> orchestrator.stop("@alice", StopReason.OFFICIAL_END)));
            // Teardown has fenced the session and is waiting for the reconnect to finish
            await().atMost(5, TimeUnit.SECONDS).until(() -> session.state() == SessionState.STOPPING);
        };

        try {
            boolean reconnected = orchestrator.reconnect("@alice");

            assertThat(reconnected).isFalse();
            assertThat(stops.get(0).get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            stopper.shutdownNow();
        }
        assertThat(orchestrator.isRecording("@alice")).isFalse();
        assertThat(client.isConnected()).isFalse();
        assertThat(client.capture().isCapturing()).isFalse();
        assertThat(client.capture().startCount).isEqualTo(1);
        assertThat(publisher.eventsOf(RecordingStoppedEvent.class)).hasSize(1);
    }

    @Test
    void reconnectAfterStopIsRefused() {
        orchestrator.start(StreamerConfig.of("@alice"));
        FakeLiveClient client = clients.sessionClient("@alice");
        client.drop("network");
        RecordingSession session = orchestrator.session("@alice").orElseThrow();
        orchestrator.stop("@alice", StopReason.MANUAL);

        assertThat(session.beginReconnect()).isFalse();
        assertThat(orchestrator.reconnect("@alice")).isFalse();
        assertThat(client.connectCount).isEqualTo(1);
    }

    @Test
    void gaugeTracksActiveSessions() {
        orchestrator.start(StreamerConfig.of("@a"));
        orchestrator.start(StreamerConfig.of("@b"));

        assertThat(registry.get("streamwatch.sessions.active").gauge().value()).isEqualTo(2.0);
    }
}
