/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.streamwatch.exception.StreamWatchException}:
 * <ul>
 *   <li>{@link com.phillippitts.streamwatch.exception.ConfigurationException} - malformed or invalid
 *       roster file; fatal at startup</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.ProbeException} - a single failed liveness probe
 *       attempt; retried and never surfaced to callers</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.RecordingStartException} - session admission
 *       aborted after rollback</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.LiveClientException} - failures reported by the
 *       live-stream client</li>
 * </ul>
 */
package com.phillippitts.streamwatch.exception;
