/**
 * Contracts for the external live-stream protocol client and media capture backend.
 *
 * <p>The wire protocol itself is out of scope. StreamWatch depends only on
 * {@link com.phillippitts.streamwatch.client.LiveClient} (liveness probe, connect/disconnect,
 * typed event stream) and {@link com.phillippitts.streamwatch.client.MediaCapture}.
 */
package com.phillippitts.streamwatch.client;
