package com.phillippitts.streamwatch.config.roster;

import com.phillippitts.streamwatch.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the roster snapshot in force and reloads it when the file's modification time changes.
 *
 * <p>The initial load happens in the constructor and is fatal on error. Later reloads that fail
 * (malformed JSON, invalid values, file deleted) are logged and leave the previous snapshot in
 * place. Command-line overrides are re-applied to every reloaded settings block.
 *
 * <p><b>Threading:</b> {@link #refresh()} is called only by the control loop; {@link #current()}
 * may be read from any thread.
 */
public class ConfigurationWatcher implements SettingsSource {

    private static final Logger LOG = LogManager.getLogger(ConfigurationWatcher.class);

    private final Path configFile;
    private final RosterLoader loader;
    private final CommandLineOverrides overrides;
    private final Clock clock;
    private final AtomicReference<RosterSnapshot> current = new AtomicReference<>();

    /**
     * Loads (or creates) the roster file.
     *
     * @throws ConfigurationException if the initial roster cannot be loaded
     */
    public ConfigurationWatcher(Path configFile,
                                RosterLoader loader,
                                CommandLineOverrides overrides,
                                Clock clock) {
        this.configFile = Objects.requireNonNull(configFile, "configFile");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.overrides = overrides == null ? CommandLineOverrides.NONE : overrides;
        this.clock = Objects.requireNonNull(clock, "clock");

        RosterFile roster = loader.loadOrCreate(configFile);
        RosterSnapshot snapshot = toSnapshot(roster, modifiedTime().orElse(null));
        current.set(snapshot);
        LOG.info("Loaded configuration {}: {} streamers ({} enabled)", configFile,
                snapshot.streamers().size(), snapshot.enabledStreamers().size());
        logCredentialSource(snapshot);
    }

    public RosterSnapshot current() {
        return current.get();
    }

    @Override
    public MonitorSettings settings() {
        return current.get().settings();
    }

    public Path configFile() {
        return configFile;
    }

    /**
     * Reloads the roster if the file changed since the last successful load.
     *
     * @return diff against the previous snapshot, or empty when the file is unchanged or the
     *         reload failed
     */
    public Optional<RosterDiff> refresh() {
        Optional<FileTime> modified = modifiedTime();
        RosterSnapshot previous = current.get();
        if (modified.isEmpty()) {
            if (previous.lastModified() != null) {
                LOG.warn("Config file {} disappeared; keeping last loaded roster", configFile);
            }
            return Optional.empty();
        }
        if (modified.get().equals(previous.lastModified())) {
            return Optional.empty();
        }

        RosterSnapshot next;
        try {
            next = toSnapshot(loader.load(configFile), modified.get());
        } catch (ConfigurationException e) {
            LOG.error("Config reload failed, keeping previous roster: {}", e.getMessage());
            // Remember the bad version so the same broken file is not re-parsed every cycle
            current.set(new RosterSnapshot(previous.streamers(), previous.settings(), modified.get(),
                    previous.loadedAt()));
            return Optional.empty();
        }

        current.set(next);
        RosterDiff diff = RosterDiff.between(previous, next);
        LOG.info("Configuration reloaded: added={}, removed={}, enabled={}, disabled={}, settingsChanged={}",
                diff.added().size(), diff.removed().size(), diff.enabled().size(),
                diff.disabled().size(), diff.settingsChanged());
        return Optional.of(diff);
    }

    private RosterSnapshot toSnapshot(RosterFile roster, FileTime modified) {
        return new RosterSnapshot(roster.streamers(), roster.settings().withOverrides(overrides),
                modified, clock.instant());
    }

    private Optional<FileTime> modifiedTime() {
        try {
            return Optional.of(Files.getLastModifiedTime(configFile));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("Cannot stat config file {}: {}", configFile, e.toString());
            return Optional.empty();
        }
    }

    private void logCredentialSource(RosterSnapshot snapshot) {
        if (overrides.credential() != null) {
            LOG.info("Using session credential from command line argument");
        } else if (snapshot.settings().credential() != null && !snapshot.settings().credential().isBlank()) {
            LOG.info("Using session credential from config file");
        } else {
            LOG.info("No session credential provided - only public streams accessible");
        }
    }
}
