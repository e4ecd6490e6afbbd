package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Chat comment.
 */
public record CommentEvent(Instant at, LiveUser user, String comment) implements LiveEvent {
}
