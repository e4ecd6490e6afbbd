package com.phillippitts.streamwatch.config.roster;

import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the roster at one point in time, with command-line overrides already applied
 * to the settings block.
 *
 * <p>Streamers are keyed by entity key; each has a non-blank username (defaulted to {@code @key}).
 */
public final class RosterSnapshot {

    private final Map<String, StreamerConfig> streamers;
    private final MonitorSettings settings;
    private final FileTime lastModified;
    private final Instant loadedAt;

    public RosterSnapshot(Map<String, StreamerConfig> streamers,
                          MonitorSettings settings,
                          FileTime lastModified,
                          Instant loadedAt) {
        Map<String, StreamerConfig> copy = new LinkedHashMap<>();
        streamers.forEach((key, cfg) -> copy.put(key, cfg.withDefaultUsername(key)));
        this.streamers = Collections.unmodifiableMap(copy);
        this.settings = settings;
        this.lastModified = lastModified;
        this.loadedAt = loadedAt;
    }

    public Map<String, StreamerConfig> streamers() {
        return streamers;
    }

    /**
     * @return enabled streamers in file order
     */
    public List<StreamerConfig> enabledStreamers() {
        return streamers.values().stream().filter(StreamerConfig::enabled).toList();
    }

    public Optional<StreamerConfig> byUsername(String username) {
        return streamers.values().stream()
                .filter(s -> s.username().equals(username))
                .findFirst();
    }

    public MonitorSettings settings() {
        return settings;
    }

    public FileTime lastModified() {
        return lastModified;
    }

    public Instant loadedAt() {
        return loadedAt;
    }
}
