package com.phillippitts.streamwatch.service.events;

import com.phillippitts.streamwatch.service.recording.AdmissionResult;
import com.phillippitts.streamwatch.service.recording.event.AdmissionRejectedEvent;
import com.phillippitts.streamwatch.service.recording.event.RecordingStoppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing hints for repeated admission problems. Throttled to one line per streamer and
 * cause per minute.
 */
@Component
class MonitorEventsListener {
    private static final Logger LOG = LogManager.getLogger(MonitorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    MonitorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onAdmissionRejected(AdmissionRejectedEvent e) {
        String key = e.result().tag() + '-' + e.username();
        if (!shouldLog(key)) {
            return;
        }
        if (e.result() == AdmissionResult.CAP_REACHED) {
            LOG.warn("{} is live but not recorded: {}. Raise max_concurrent_recordings or disable "
                    + "lower-priority streamers.", e.username(), e.message());
        } else if (e.result() == AdmissionResult.FAILED) {
            LOG.warn("Recording {} failed to start: {}. Check the output directory and credentials "
                    + "(age-restricted streams need a session credential).", e.username(), e.message());
        }
    }

    @EventListener
    void onRecordingStopped(RecordingStoppedEvent e) {
        lastLog.keySet().removeIf(k -> k.endsWith('-' + e.username()));
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
