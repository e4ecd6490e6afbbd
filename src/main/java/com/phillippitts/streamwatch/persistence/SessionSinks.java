package com.phillippitts.streamwatch.persistence;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The set of per-kind event sinks opened for one recording session.
 *
 * <p>{@link #open} is all-or-nothing: if any sink fails to open, the ones already opened are
 * closed before the failure propagates. {@link #closeAll()} closes every sink exactly once no
 * matter how often it is called.
 */
public final class SessionSinks {

    private static final Logger LOG = LogManager.getLogger(SessionSinks.class);

    /**
     * Opens the sink for one event kind.
     */
    @FunctionalInterface
    public interface SinkFactory {
        EventSink open(Path file, EventKind kind) throws IOException;
    }

    private final Map<EventKind, EventSink> sinks;
    private final AtomicBoolean closed = new AtomicBoolean();

    private SessionSinks(Map<EventKind, EventSink> sinks) {
        this.sinks = Collections.unmodifiableMap(sinks);
    }

    /**
     * Opens one sink per {@link EventKind} named {@code <baseName>_<suffix>.csv} in {@code dir}.
     *
     * @throws IOException if any sink cannot be opened (all opened sinks are closed first)
     */
    public static SessionSinks open(Path dir, String baseName, SinkFactory factory) throws IOException {
        Map<EventKind, EventSink> opened = new EnumMap<>(EventKind.class);
        try {
            for (EventKind kind : EventKind.values()) {
                Path file = dir.resolve(baseName + "_" + kind.fileSuffix() + ".csv");
                opened.put(kind, factory.open(file, kind));
            }
        } catch (IOException | RuntimeException e) {
            closeQuietly(opened.values());
            throw e;
        }
        return new SessionSinks(opened);
    }

    public EventSink sink(EventKind kind) {
        return sinks.get(kind);
    }

    public Map<EventKind, EventSink> all() {
        return sinks;
    }

    /**
     * Closes all sinks on the first call; later calls are ignored.
     *
     * @return {@code true} if this call closed the sinks
     */
    public boolean closeAll() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        closeQuietly(sinks.values());
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private static void closeQuietly(Collection<EventSink> toClose) {
        for (EventSink sink : toClose) {
            try {
                sink.close();
            } catch (IOException e) {
                LOG.warn("Failed to close sink {}: {}", sink.path(), e.toString());
            }
        }
    }
}
