package com.phillippitts.streamwatch.service.recording.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published once a recording session is connected and capturing.
 */
public record RecordingStartedEvent(String username, Instant at, Path mediaFile) { }
