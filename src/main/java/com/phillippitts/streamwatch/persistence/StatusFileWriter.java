package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Overwrites the status file with a {@link MonitorStatus} snapshot.
 *
 * <p>The snapshot is written to a sibling temp file and moved into place, so readers never see a
 * half-written file. Failures are logged, never thrown.
 */
public class StatusFileWriter {

    private static final Logger LOG = LogManager.getLogger(StatusFileWriter.class);

    private final Path file;
    private final ObjectMapper mapper;

    public StatusFileWriter(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path file() {
        return file;
    }

    public void write(MonitorStatus status) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tmp.toFile(), status);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            LOG.warn("Failed to write status file {}: {}", file, e.toString());
        }
    }
}
