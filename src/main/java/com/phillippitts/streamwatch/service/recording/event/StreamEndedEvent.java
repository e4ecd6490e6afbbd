package com.phillippitts.streamwatch.service.recording.event;

import java.time.Instant;

/**
 * The platform signalled that the broadcast of an active session ended.
 */
public record StreamEndedEvent(String username, Instant at, String reason) { }
