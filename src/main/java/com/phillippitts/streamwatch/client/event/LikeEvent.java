package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Burst of likes (reactions) from one viewer; {@code total} is the broadcast's running total.
 */
public record LikeEvent(Instant at, LiveUser user, long count, long total) implements LiveEvent {
}
