package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Authoritative end-of-broadcast signal from the platform.
 */
public record StreamEndEvent(Instant at, String reason) implements LiveEvent {
}
