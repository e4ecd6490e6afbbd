package com.phillippitts.streamwatch.config.roster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.phillippitts.streamwatch.exception.ConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads, validates and (when absent) creates the roster/settings JSON file.
 *
 * <p>Parsing uses Jackson; constraint checks use Jakarta Bean Validation. Every failure is
 * reported as a {@link ConfigurationException} naming the file.
 */
public class RosterLoader {

    private static final Logger LOG = LogManager.getLogger(RosterLoader.class);

    private final ObjectMapper mapper;
    private final Validator validator;

    public RosterLoader(ObjectMapper mapper, Validator validator) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Loads the roster file, writing the documented default roster first if it does not exist.
     *
     * @param file roster file
     * @return parsed and validated roster
     * @throws ConfigurationException if the file is unreadable, malformed or violates constraints
     */
    public RosterFile loadOrCreate(Path file) {
        if (!Files.exists(file)) {
            RosterFile defaults = RosterFile.defaultRoster();
            write(file, defaults);
            LOG.info("Created default config file: {}", file.toAbsolutePath());
            return defaults;
        }
        return load(file);
    }

    /**
     * Loads an existing roster file.
     *
     * @throws ConfigurationException if the file is missing, unreadable, malformed or invalid
     */
    public RosterFile load(Path file) {
        RosterFile roster;
        try {
            roster = mapper.readValue(file.toFile(), RosterFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(file, "malformed JSON at line "
                    + (e.getLocation() == null ? "?" : e.getLocation().getLineNr()) + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException(file, "cannot read file: " + e.getMessage(), e);
        }
        if (roster == null) {
            throw new ConfigurationException(file, "file is empty");
        }
        validate(file, roster);
        return roster;
    }

    /**
     * Writes {@code roster} as pretty-printed JSON, creating parent directories as needed.
     */
    public void write(Path file, RosterFile roster) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), roster);
        } catch (IOException e) {
            throw new ConfigurationException(file, "cannot write file: " + e.getMessage(), e);
        }
    }

    private void validate(Path file, RosterFile roster) {
        Set<ConstraintViolation<RosterFile>> violations = validator.validate(roster);
        if (violations.isEmpty()) {
            rejectDuplicateUsernames(file, roster);
            return;
        }
        String details = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining("; "));
        throw new ConfigurationException(file, details);
    }

    /**
     * Rejects rosters in which two keys resolve to the same username.
     */
    private void rejectDuplicateUsernames(Path file, RosterFile roster) {
        Map<String, String> owners = new HashMap<>();
        for (Map.Entry<String, StreamerConfig> entry : roster.streamers().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String username = entry.getValue().withDefaultUsername(entry.getKey()).username();
            String previous = owners.putIfAbsent(username, entry.getKey());
            if (previous != null) {
                throw new ConfigurationException(file, "streamers '" + previous + "' and '"
                        + entry.getKey() + "' share username " + username);
            }
        }
    }
}
