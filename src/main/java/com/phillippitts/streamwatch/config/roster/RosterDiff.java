package com.phillippitts.streamwatch.config.roster;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Difference between two roster snapshots, computed over entity keys and enabled flags.
 *
 * <p>A key whose username changed is reported as removed (old username) and added (new one).
 *
 * @param added streamers newly present and enabled
 * @param removed streamers no longer present (previous values)
 * @param enabled streamers present in both and switched from disabled to enabled
 * @param disabled streamers present in both and switched from enabled to disabled
 * @param settingsChanged whether the settings block differs
 */
public record RosterDiff(List<StreamerConfig> added,
                         List<StreamerConfig> removed,
                         List<StreamerConfig> enabled,
                         List<StreamerConfig> disabled,
                         boolean settingsChanged) {

    public static RosterDiff between(RosterSnapshot previous, RosterSnapshot current) {
        Map<String, StreamerConfig> before = previous.streamers();
        Map<String, StreamerConfig> after = current.streamers();

        List<StreamerConfig> added = new ArrayList<>();
        List<StreamerConfig> removed = new ArrayList<>();
        List<StreamerConfig> enabled = new ArrayList<>();
        List<StreamerConfig> disabled = new ArrayList<>();

        for (Map.Entry<String, StreamerConfig> entry : before.entrySet()) {
            StreamerConfig now = after.get(entry.getKey());
            StreamerConfig was = entry.getValue();
            if (now == null || !now.username().equals(was.username())) {
                removed.add(was);
            } else if (was.enabled() && !now.enabled()) {
                disabled.add(now);
            } else if (!was.enabled() && now.enabled()) {
                enabled.add(now);
            }
        }
        for (Map.Entry<String, StreamerConfig> entry : after.entrySet()) {
            StreamerConfig was = before.get(entry.getKey());
            StreamerConfig now = entry.getValue();
            if ((was == null || !was.username().equals(now.username())) && now.enabled()) {
                added.add(now);
            }
        }
        boolean settingsChanged = !previous.settings().equals(current.settings());
        return new RosterDiff(List.copyOf(added), List.copyOf(removed), List.copyOf(enabled),
                List.copyOf(disabled), settingsChanged);
    }

    /**
     * @return streamers whose active sessions must be stopped: removed ones that were enabled, and
     *         newly disabled ones
     */
    public List<StreamerConfig> toStop() {
        List<StreamerConfig> out = new ArrayList<>();
        removed.stream().filter(StreamerConfig::enabled).forEach(out::add);
        out.addAll(disabled);
        return out;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && enabled.isEmpty() && disabled.isEmpty()
                && !settingsChanged;
    }
}
