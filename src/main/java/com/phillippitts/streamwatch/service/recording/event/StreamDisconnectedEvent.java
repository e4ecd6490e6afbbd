package com.phillippitts.streamwatch.service.recording.event;

import java.time.Instant;

/**
 * The live connection of an active session dropped without an end-of-broadcast signal.
 */
public record StreamDisconnectedEvent(String username, Instant at, String reason) { }
