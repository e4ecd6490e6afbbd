package com.phillippitts.streamwatch.service.control;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Sentinel-file control channel, checked once per poll cycle.
 *
 * <ul>
 *   <li><b>Stop file</b>: optional text is the stop reason. Takes precedence over pause.</li>
 *   <li><b>Pause file</b>: optional text is the pause length in seconds; blank or invalid text
 *       means the default.</li>
 * </ul>
 *
 * Both files are deleted as soon as they are read.
 */
public class ControlSignalChannel {

    private static final Logger LOG = LogManager.getLogger(ControlSignalChannel.class);

    static final String DEFAULT_STOP_REASON = "stop file";

    private final Path stopFile;
    private final Path pauseFile;
    private final Duration defaultPause;

    public ControlSignalChannel(Path stopFile, Path pauseFile, Duration defaultPause) {
        this.stopFile = Objects.requireNonNull(stopFile, "stopFile");
        this.pauseFile = Objects.requireNonNull(pauseFile, "pauseFile");
        this.defaultPause = Objects.requireNonNull(defaultPause, "defaultPause");
    }

    /**
     * Reads and consumes pending signals.
     *
     * @return the signal to act on, {@link ControlSignal#NONE} if there is none
     */
    public ControlSignal check() {
        if (Files.exists(stopFile)) {
            String text = consume(stopFile);
            String reason = text.isBlank() ? DEFAULT_STOP_REASON : text.strip();
            LOG.info("Stop file found: {}", reason);
            return ControlSignal.stop(reason);
        }
        if (Files.exists(pauseFile)) {
            Duration pause = parsePause(consume(pauseFile));
            LOG.info("Pause file found: pausing polling for {}s", pause.toSeconds());
            return ControlSignal.pause(pause);
        }
        return ControlSignal.NONE;
    }

    Duration parsePause(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return defaultPause;
        }
        try {
            int seconds = Integer.parseInt(trimmed);
            if (seconds > 0) {
                return Duration.ofSeconds(seconds);
            }
        } catch (NumberFormatException e) {
            // fall through to default
        }
        LOG.warn("Invalid pause duration '{}' in {}; using {}s", trimmed, pauseFile, defaultPause.toSeconds());
        return defaultPause;
    }

    private static String consume(Path file) {
        String text = "";
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Could not read control file {}: {}", file, e.toString());
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete control file {}: {}", file, e.toString());
        }
        return text;
    }

    public Path stopFile() {
        return stopFile;
    }

    public Path pauseFile() {
        return pauseFile;
    }
}
