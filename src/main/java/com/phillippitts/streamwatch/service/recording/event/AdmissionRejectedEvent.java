package com.phillippitts.streamwatch.service.recording.event;

import com.phillippitts.streamwatch.service.recording.AdmissionResult;

import java.time.Instant;

/**
 * Published when a confirmed-live streamer could not be recorded.
 *
 * @param result {@code DUPLICATE}, {@code CAP_REACHED} or {@code FAILED}
 * @param message human-readable cause, also written to the summary log
 */
public record AdmissionRejectedEvent(String username, Instant at, AdmissionResult result, String message) { }
