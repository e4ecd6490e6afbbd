package com.phillippitts.streamwatch.config.roster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.streamwatch.exception.ConfigurationException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterLoaderTest {

    @TempDir
    Path dir;

    private final RosterLoader loader = new RosterLoader(new ObjectMapper(),
            Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    void shouldCreateDefaultRosterWhenFileIsMissing() {
        Path file = dir.resolve("nested").resolve("streamers_config.json");

        RosterFile roster = loader.loadOrCreate(file);

        assertThat(file).exists();
        assertThat(roster.streamers()).containsOnlyKeys("example_user1", "example_user2");
        assertThat(roster.settings()).isEqualTo(MonitorSettings.defaults());
        assertThat(loader.load(file).streamers()).containsOnlyKeys("example_user1", "example_user2");
    }

    @Test
    void shouldApplyDefaultsForMissingSettings() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, """
                {
                  "streamers": {
                    "alice": {"username": "@alice", "tags": ["music"], "notes": "evenings"},
                    "bob": {"username": "@bob", "enabled": false, "session_id": "abc", "tt_target_idc": "eu-ttp"}
                  },
                  "settings": {"check_interval_seconds": 15, "some_future_key": true}
                }
                """);

        RosterFile roster = loader.load(file);

        MonitorSettings settings = roster.settings();
        assertThat(settings.checkIntervalSeconds()).isEqualTo(15);
        assertThat(settings.maxConcurrentRecordings()).isEqualTo(3);
        assertThat(settings.stabilityThreshold()).isEqualTo(3);
        assertThat(settings.cooldownSeconds()).isEqualTo(90);
        assertThat(settings.disconnectGraceSeconds()).isEqualTo(30);
        assertThat(settings.region()).isEqualTo(MonitorSettings.DEFAULT_REGION);

        StreamerConfig alice = roster.streamers().get("alice");
        assertThat(alice.enabled()).isTrue();
        assertThat(alice.tags()).containsExactly("music");
        StreamerConfig bob = roster.streamers().get("bob");
        assertThat(bob.enabled()).isFalse();
        assertThat(bob.credential()).isEqualTo("abc");
        assertThat(bob.region()).isEqualTo("eu-ttp");
    }

    @Test
    void shouldRejectMalformedJson() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, "{\"streamers\": {");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("malformed JSON")
                .satisfies(e -> assertThat(((ConfigurationException) e).getConfigFile()).isEqualTo(file));
    }

    @Test
    void shouldRejectInvalidValues() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, """
                {"streamers": {}, "settings": {"max_concurrent_recordings": 0, "check_interval_seconds": -1}}
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_concurrent_recordings must be positive")
                .hasMessageContaining("check_interval_seconds must be positive");
    }

    @Test
    void shouldRejectEmptyFile() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, "");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectTwoKeysWithTheSameUsername() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, """
                {"streamers": {"a": {"username": "@x"}, "b": {"username": "@x"}}}
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'a' and 'b' share username @x");
    }

    @Test
    void shouldRejectExplicitUsernameCollidingWithDefaultedOne() throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, """
                {"streamers": {"x": {"enabled": true}, "other": {"username": "@x"}}}
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("share username @x");
    }
}
