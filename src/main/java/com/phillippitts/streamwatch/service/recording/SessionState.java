package com.phillippitts.streamwatch.service.recording;

/**
 * Lifecycle of one {@link RecordingSession}.
 *
 * <pre>
 * STARTING → RECORDING → STOPPING → STOPPED
 * STARTING → STOPPING (start failed, or stop requested during start)
 * </pre>
 *
 * Events are persisted only in {@link #RECORDING}.
 */
public enum SessionState {
    STARTING,
    RECORDING,
    STOPPING,
    STOPPED
}
