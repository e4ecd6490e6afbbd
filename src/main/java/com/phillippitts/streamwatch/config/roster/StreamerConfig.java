package com.phillippitts.streamwatch.config.roster;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.streamwatch.client.Credentials;

import java.util.List;

/**
 * One monitored streamer as declared in the roster file.
 *
 * <p>{@code credential} and {@code region} override the settings-level defaults for this streamer
 * only. {@code tags} and {@code notes} are opaque to the monitor and copied into the session log.
 * The legacy keys {@code session_id} and {@code tt_target_idc} are accepted as aliases.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record StreamerConfig(
        @JsonProperty("username") String username,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("credential") @JsonAlias("session_id") String credential,
        @JsonProperty("region") @JsonAlias("tt_target_idc") String region,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("notes") String notes
) {
    public StreamerConfig {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        tags = tags == null ? List.of() : List.copyOf(tags);
        notes = notes == null ? "" : notes;
    }

    /**
     * Shorthand for an enabled streamer without overrides, tags or notes.
     */
    public static StreamerConfig of(String username) {
        return new StreamerConfig(username, true, null, null, List.of(), "");
    }

    /**
     * Returns a copy whose username defaults to {@code @key} when blank.
     */
    StreamerConfig withDefaultUsername(String key) {
        if (username != null && !username.isBlank()) {
            return this;
        }
        return new StreamerConfig("@" + key, enabled, credential, region, tags, notes);
    }

    /**
     * Resolves the credentials used to reach this streamer: per-streamer values win, the settings
     * block supplies the rest.
     */
    public Credentials credentials(MonitorSettings settings) {
        String c = credential != null && !credential.isBlank() ? credential : settings.credential();
        String r = region != null && !region.isBlank() ? region : settings.region();
        return new Credentials(c, r);
    }
}
