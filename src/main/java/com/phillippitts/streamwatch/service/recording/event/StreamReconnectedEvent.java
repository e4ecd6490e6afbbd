package com.phillippitts.streamwatch.service.recording.event;

import java.time.Instant;

/**
 * The live connection of an active session was (re)established after a drop.
 */
public record StreamReconnectedEvent(String username, Instant at, String roomId) { }
