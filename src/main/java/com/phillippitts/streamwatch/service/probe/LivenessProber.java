package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.config.roster.StreamerConfig;

/**
 * Answers whether one streamer is currently on air.
 *
 * <p>Implementations never report "unknown": any failure that survives their retry policy is
 * reported as {@code false}.
 */
@FunctionalInterface
public interface LivenessProber {

    /**
     * @param streamer streamer to probe
     * @return {@code true} only if the platform positively confirmed the streamer is live
     */
    boolean isLive(StreamerConfig streamer);
}
