package com.phillippitts.streamwatch.config.roster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON binding of the roster/settings file: streamers keyed by a stable entity key, plus the
 * settings block.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RosterFile(
        @JsonProperty("streamers") @NotNull Map<String, @Valid StreamerConfig> streamers,
        @JsonProperty("settings") @NotNull @Valid MonitorSettings settings
) {
    public RosterFile {
        streamers = streamers == null ? Map.of() : new LinkedHashMap<>(streamers);
        settings = settings == null ? MonitorSettings.defaults() : settings;
    }

    /**
     * Roster written when no configuration file exists yet.
     */
    public static RosterFile defaultRoster() {
        Map<String, StreamerConfig> streamers = new LinkedHashMap<>();
        streamers.put("example_user1", new StreamerConfig("@example_user1", true, null, null,
                List.of("research", "category1"), "Example streamer for research"));
        streamers.put("example_user2", new StreamerConfig("@example_user2", true, null, null,
                List.of("research", "category2"), "Another example streamer"));
        return new RosterFile(streamers, MonitorSettings.defaults());
    }
}
