package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.config.roster.StreamerConfig;

import java.util.List;
import java.util.Optional;

/**
 * Admission-controlled owner of all recording sessions.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>at most one session per streamer;</li>
 *   <li>never more than {@code max_concurrent_recordings} sessions, counting sessions still
 *       starting; the cap rejects, it does not queue;</li>
 *   <li>a stopped session is removed from the active set even when teardown partly fails.</li>
 * </ul>
 */
public interface RecordingOrchestrator {

    /**
     * Admits and brings up a session for {@code streamer}. Blocks while connecting.
     *
     * @return admission outcome; rejections and failures are logged and summarized, not thrown
     */
    AdmissionResult start(StreamerConfig streamer);

    /**
     * Stops the streamer's session. A no-op (logged) when no session exists.
     *
     * @return {@code true} if this call stopped the session or scheduled its stop
     */
    boolean stop(String username, StopReason reason);

    /**
     * Stops every active session with the same reason.
     */
    void stopAll(StopReason reason);

    /**
     * Re-establishes the live connection of an active session whose client dropped.
     *
     * @return {@code true} if the session is connected afterwards; {@code false} if the connect fails
     *         or the session stops meanwhile
     */
    boolean reconnect(String username);

    /**
     * @return whether a session exists for the streamer, in any state
     */
    boolean isRecording(String username);

    Optional<RecordingSession> session(String username);

    int activeCount();

    /**
     * @return usernames of all sessions, sorted
     */
    List<String> activeUsernames();
}
