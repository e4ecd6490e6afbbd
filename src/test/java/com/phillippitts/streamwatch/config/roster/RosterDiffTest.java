package com.phillippitts.streamwatch.config.roster;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RosterDiffTest {

    private static StreamerConfig streamer(String username, boolean enabled) {
        return new StreamerConfig(username, enabled, null, null, List.of(), "");
    }

    private static RosterSnapshot snapshot(StreamerConfig... streamers) {
        return snapshot(MonitorSettings.defaults(), streamers);
    }

    private static RosterSnapshot snapshot(MonitorSettings settings, StreamerConfig... streamers) {
        Map<String, StreamerConfig> map = new LinkedHashMap<>();
        for (StreamerConfig s : streamers) {
            map.put(s.username().substring(1), s);
        }
        return new RosterSnapshot(map, settings, null, Instant.EPOCH);
    }

    @Test
    void identicalSnapshotsYieldEmptyDiff() {
        RosterDiff diff = RosterDiff.between(snapshot(streamer("@a", true)), snapshot(streamer("@a", true)));

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.toStop()).isEmpty();
    }

    @Test
    void disablingAndRemovingAreBothStops() {
        RosterSnapshot before = snapshot(streamer("@a", true), streamer("@b", true), streamer("@c", false));
        RosterSnapshot after = snapshot(streamer("@a", false));

        RosterDiff diff = RosterDiff.between(before, after);

        assertThat(diff.disabled()).extracting(StreamerConfig::username).containsExactly("@a");
        assertThat(diff.removed()).extracting(StreamerConfig::username).containsExactly("@b", "@c");
        // @c was already disabled, so there is nothing to stop for it
        assertThat(diff.toStop()).extracting(StreamerConfig::username).containsExactlyInAnyOrder("@a", "@b");
    }

    @Test
    void reEnablingIsReportedSeparatelyFromAdding() {
        RosterDiff diff = RosterDiff.between(snapshot(streamer("@a", false)),
                snapshot(streamer("@a", true), streamer("@b", true), streamer("@c", false)));

        assertThat(diff.enabled()).extracting(StreamerConfig::username).containsExactly("@a");
        assertThat(diff.added()).extracting(StreamerConfig::username).containsExactly("@b");
    }

    @Test
    void renamedUsernameUnderSameKeyIsRemoveAndAdd() {
        Map<String, StreamerConfig> before = Map.of("key", streamer("@old", true));
        Map<String, StreamerConfig> after = Map.of("key", streamer("@new", true));

        RosterDiff diff = RosterDiff.between(
                new RosterSnapshot(before, MonitorSettings.defaults(), null, Instant.EPOCH),
                new RosterSnapshot(after, MonitorSettings.defaults(), null, Instant.EPOCH));

        assertThat(diff.removed()).extracting(StreamerConfig::username).containsExactly("@old");
        assertThat(diff.added()).extracting(StreamerConfig::username).containsExactly("@new");
    }

    @Test
    void settingsChangeIsDetected() {
        MonitorSettings changed = new MonitorSettings(60, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);

        RosterDiff diff = RosterDiff.between(snapshot(), snapshot(changed));

        assertThat(diff.settingsChanged()).isTrue();
        assertThat(diff.isEmpty()).isFalse();
    }
}
