package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Marker for every typed event emitted by a {@link com.phillippitts.streamwatch.client.LiveClient}.
 */
public interface LiveEvent {

    /**
     * @return time the event was received from the platform
     */
    Instant at();
}
