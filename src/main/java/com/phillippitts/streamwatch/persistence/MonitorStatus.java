package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot written to the status file each cycle.
 */
public record MonitorStatus(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("state") String state,
        @JsonProperty("paused_until") String pausedUntil,
        @JsonProperty("active_recordings") int activeRecordings,
        @JsonProperty("recording") List<String> recording,
        @JsonProperty("pending_disconnects") int pendingDisconnects,
        @JsonProperty("monitored_streamers") int monitoredStreamers,
        @JsonProperty("cycle") long cycle,
        @JsonProperty("pid") long pid
) {
    public MonitorStatus {
        recording = recording == null ? List.of() : List.copyOf(recording);
    }
}
