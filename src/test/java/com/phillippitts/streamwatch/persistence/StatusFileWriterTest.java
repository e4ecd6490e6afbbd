package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class StatusFileWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldOverwriteStatusWithLatestSnapshot() throws IOException {
        StatusFileWriter writer = new StatusFileWriter(dir.resolve("state").resolve("monitor_status.json"), mapper);

        writer.write(new MonitorStatus("2025-07-01T07:53:47", "RUNNING", null, 1, List.of("@alice"), 0, 4, 1, 42));
        writer.write(new MonitorStatus("2025-07-01T07:54:17", "PAUSED", "2025-07-01T07:59:17", 1,
                List.of("@alice"), 1, 4, 2, 42));

        JsonNode status = mapper.readTree(writer.file().toFile());
        assertThat(status.get("state").asText()).isEqualTo("PAUSED");
        assertThat(status.get("paused_until").asText()).isEqualTo("2025-07-01T07:59:17");
        assertThat(status.get("pending_disconnects").asInt()).isEqualTo(1);
        assertThat(status.get("cycle").asLong()).isEqualTo(2);
        assertThat(status.get("pid").asLong()).isEqualTo(42);
        try (Stream<Path> files = Files.list(writer.file().getParent())) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("monitor_status.json");
        }
    }
}
