package com.phillippitts.streamwatch.service.monitor;

/**
 * Overall state of the control loop, as reported in the status file and health endpoint.
 */
public enum MonitorState {
    STARTING,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED
}
