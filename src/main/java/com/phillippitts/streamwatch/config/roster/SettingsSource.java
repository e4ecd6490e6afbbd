package com.phillippitts.streamwatch.config.roster;

/**
 * Supplies the settings currently in force. Implemented by {@link ConfigurationWatcher}; values
 * may change between calls after a reload, so callers read it per operation rather than caching.
 */
@FunctionalInterface
public interface SettingsSource {

    MonitorSettings settings();
}
