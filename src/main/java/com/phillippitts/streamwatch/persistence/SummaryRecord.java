package com.phillippitts.streamwatch.persistence;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the session summary log: a start, stop or admission failure for a streamer.
 *
 * @param at time the action happened
 * @param username streamer
 * @param action {@code recording_started}, {@code recording_attempt} or {@code recording_stopped_<reason>}
 * @param status {@code success} or {@code failed}
 * @param durationMinutes session duration (0 for starts and failures)
 * @param counts per-kind event counts (empty for starts and failures)
 * @param tags streamer tags from the roster
 * @param notes streamer notes from the roster
 * @param errorMessage error text for failures, otherwise empty
 */
public record SummaryRecord(Instant at,
                            String username,
                            String action,
                            String status,
                            double durationMinutes,
                            Map<EventKind, Long> counts,
                            List<String> tags,
                            String notes,
                            String errorMessage) {

    public static final String ACTION_STARTED = "recording_started";
    public static final String ACTION_ATTEMPT = "recording_attempt";
    public static final String ACTION_STOPPED_PREFIX = "recording_stopped_";
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    public SummaryRecord {
        Map<EventKind, Long> copy = new EnumMap<>(EventKind.class);
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Map.copyOf(copy);
        tags = tags == null ? List.of() : List.copyOf(tags);
        notes = notes == null ? "" : notes;
        errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public long count(EventKind kind) {
        return counts.getOrDefault(kind, 0L);
    }
}
