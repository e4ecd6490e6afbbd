package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-level settings for the monitor (file locations, loop behaviour).
 *
 * <p>Roster-level settings (poll interval, concurrency cap, thresholds) live in the roster file
 * and are hot-reloadable; these are read once at startup.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public class MonitorProperties {

    /** Roster/settings JSON file. Also settable with {@code --config=}. */
    @NotBlank(message = "Config file must not be blank")
    private String configFile = "streamers_config.json";

    /** Directory watched for the stop/pause sentinel files. */
    @NotBlank(message = "Control directory must not be blank")
    private String controlDir = ".";

    /** Sentinel file name that stops monitoring after a graceful drain. */
    @NotBlank
    private String stopFile = "monitor.stop";

    /** Sentinel file name that pauses polling. */
    @NotBlank
    private String pauseFile = "monitor.pause";

    /** Pause duration used when the pause file is empty or unreadable. */
    @Positive(message = "Default pause seconds must be positive")
    private int defaultPauseSeconds = 60;

    /** Periodically overwritten status snapshot. */
    @NotBlank
    private String statusFile = "monitor_status.json";

    /** Directory receiving the daily session summary log. */
    @NotBlank
    private String logDir = ".";

    /** Lower bound for the sleep between poll cycles. */
    @Positive
    private int minSleepSeconds = 5;

    /** Back-off after an unexpected error in the control loop. */
    @Positive
    private int errorBackoffSeconds = 30;

    /** Maximum wait for the control loop to drain during context shutdown. */
    @Positive
    private int shutdownTimeoutSeconds = 30;

    /** Run the control loop on startup. Disabled in tests that only need the context. */
    private boolean autostart = true;

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public String getControlDir() {
        return controlDir;
    }

    public void setControlDir(String controlDir) {
        this.controlDir = controlDir;
    }

    public String getStopFile() {
        return stopFile;
    }

    public void setStopFile(String stopFile) {
        this.stopFile = stopFile;
    }

    public String getPauseFile() {
        return pauseFile;
    }

    public void setPauseFile(String pauseFile) {
        this.pauseFile = pauseFile;
    }

    public int getDefaultPauseSeconds() {
        return defaultPauseSeconds;
    }

    public void setDefaultPauseSeconds(int defaultPauseSeconds) {
        this.defaultPauseSeconds = defaultPauseSeconds;
    }

    public String getStatusFile() {
        return statusFile;
    }

    public void setStatusFile(String statusFile) {
        this.statusFile = statusFile;
    }

    public String getLogDir() {
        return logDir;
    }

    public void setLogDir(String logDir) {
        this.logDir = logDir;
    }

    public int getMinSleepSeconds() {
        return minSleepSeconds;
    }

    public void setMinSleepSeconds(int minSleepSeconds) {
        this.minSleepSeconds = minSleepSeconds;
    }

    public int getErrorBackoffSeconds() {
        return errorBackoffSeconds;
    }

    public void setErrorBackoffSeconds(int errorBackoffSeconds) {
        this.errorBackoffSeconds = errorBackoffSeconds;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }
}
