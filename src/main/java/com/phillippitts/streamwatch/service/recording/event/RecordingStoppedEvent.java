package com.phillippitts.streamwatch.service.recording.event;

import com.phillippitts.streamwatch.persistence.EventKind;
import com.phillippitts.streamwatch.service.recording.StopReason;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Published after a session has been torn down and removed from the active set.
 */
public record RecordingStoppedEvent(
        String username,
        Instant at,
        StopReason reason,
        Duration duration,
        Map<EventKind, Long> counts
) {
    public RecordingStoppedEvent {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
    }
}
