package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Connection established.
 */
public record ConnectEvent(Instant at, String roomId) implements LiveEvent {
}
