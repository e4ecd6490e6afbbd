package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Generic connection drop. Not authoritative: the broadcast may still be running.
 */
public record DisconnectEvent(Instant at, String reason) implements LiveEvent {
}
