package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.client.LiveClient;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import com.phillippitts.streamwatch.persistence.EventKind;
import com.phillippitts.streamwatch.persistence.SessionSinks;

import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One streamer's active recording: its connection, its sinks, its counters and its lifecycle
 * state.
 *
 * <p><b>Fencing:</b> {@link #isRecording()} is the gate every event handler checks before writing.
 * It turns false the moment a stop begins, before any resource is released, so late events are
 * dropped instead of hitting a closing sink.
 *
 * <p><b>Thread Safety:</b> state transitions are synchronized; the state itself is volatile so the
 * fencing check is lock-free. Counters are atomic. A reconnect holds the reconnect lock from its
 * state check to its last client call; teardown waits for it before releasing the client.
 */
public final class RecordingSession {

    /**
     * Result of {@link #requestStop(StopReason)}.
     */
    public enum StopRequest {
        /** Caller owns teardown. */
        PROCEED,
        /** Session is still starting; the starting task will tear it down. */
        DEFERRED,
        /** Teardown already in progress or done. */
        ALREADY_STOPPING
    }

    private final StreamerConfig streamer;
    private final String baseName;
    private final Instant startedAt;
    private final Map<EventKind, AtomicLong> counts = new EnumMap<>(EventKind.class);

    private volatile SessionState state = SessionState.STARTING;
    private volatile StopReason deferredStop;
    private volatile LiveClient client;
    private volatile SessionSinks sinks;
    private volatile Path mediaFile;
    private final ReentrantLock reconnectLock = new ReentrantLock();
    private int reconnects;

    public RecordingSession(StreamerConfig streamer, String baseName, Instant startedAt) {
        this.streamer = streamer;
        this.baseName = baseName;
        this.startedAt = startedAt;
        for (EventKind kind : EventKind.values()) {
            counts.put(kind, new AtomicLong());
        }
    }

    public String username() {
        return streamer.username();
    }

    public StreamerConfig streamer() {
        return streamer;
    }

    /**
     * @return file name prefix shared by this session's CSV and media files
     */
    public String baseName() {
        return baseName;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public SessionState state() {
        return state;
    }

    public boolean isRecording() {
        return state == SessionState.RECORDING;
    }

    public LiveClient client() {
        return client;
    }

    public SessionSinks sinks() {
        return sinks;
    }

    public Path mediaFile() {
        return mediaFile;
    }

    void attachClient(LiveClient client) {
        this.client = client;
    }

    void attachSinks(SessionSinks sinks) {
        this.sinks = sinks;
    }

    void attachMedia(Path mediaFile) {
        this.mediaFile = mediaFile;
    }

    synchronized int nextReconnect() {
        return ++reconnects;
    }

    /**
     * Takes the reconnect lock if the session is RECORDING. Callers that get {@code true} must call
     * {@link #endReconnect()}.
     */
    boolean beginReconnect() {
        reconnectLock.lock();
        if (isRecording()) {
            return true;
        }
        reconnectLock.unlock();
        return false;
    }

    void endReconnect() {
        reconnectLock.unlock();
    }

    /**
     * Blocks until no reconnect is in progress. Called after the stop fence, so no new one starts.
     */
    void awaitReconnect() {
        reconnectLock.lock();
        reconnectLock.unlock();
    }

    /**
     * STARTING → RECORDING, unless a stop was requested while starting.
     *
     * @return {@code true} if the session is now recording
     */
    synchronized boolean activate() {
        if (state != SessionState.STARTING || deferredStop != null) {
            return false;
        }
        state = SessionState.RECORDING;
        return true;
    }

    synchronized StopRequest requestStop(StopReason reason) {
        switch (state) {
            case STARTING:
                if (deferredStop == null) {
                    deferredStop = reason;
                }
                return StopRequest.DEFERRED;
            case RECORDING:
                state = SessionState.STOPPING;
                return StopRequest.PROCEED;
            default:
                return StopRequest.ALREADY_STOPPING;
        }
    }

    /**
     * Moves a session that never reached RECORDING into teardown.
     */
    synchronized void abortStart() {
        state = SessionState.STOPPING;
    }

    synchronized void markStopped() {
        state = SessionState.STOPPED;
    }

    /**
     * @return reason of a stop requested while starting, or {@code null}
     */
    public StopReason deferredStop() {
        return deferredStop;
    }

    long increment(EventKind kind) {
        return counts.get(kind).incrementAndGet();
    }

    public long count(EventKind kind) {
        return counts.get(kind).get();
    }

    /**
     * @return snapshot of the per-kind counters
     */
    public Map<EventKind, Long> counts() {
        Map<EventKind, Long> snapshot = new EnumMap<>(EventKind.class);
        counts.forEach((k, v) -> snapshot.put(k, v.get()));
        return snapshot;
    }

    @Override
    public String toString() {
        return "RecordingSession{" + username() + ", state=" + state + ", startedAt=" + startedAt + '}';
    }
}
