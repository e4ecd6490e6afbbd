/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.streamwatch.config.MonitorConfig} - wiring of the roster watcher,
 *       prober, stability tracker, recording orchestrator and control loop</li>
 *   <li>{@link com.phillippitts.streamwatch.config.ThreadPoolConfig} - probe and session executors
 *       and the disconnect-confirmation scheduler</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - process-level settings from {@code application.properties}</li>
 *   <li>{@code config.roster} - the hot-reloaded streamer roster file</li>
 * </ul>
 */
package com.phillippitts.streamwatch.config;
