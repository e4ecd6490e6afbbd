package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only CSV log of session starts, stops and admission failures, one file per day
 * ({@code monitoring_sessions_yyyyMMdd.csv}).
 *
 * <p>Write failures are logged and swallowed: the summary log is a sink and must never disturb a
 * session's lifecycle.
 */
public class SessionSummaryLog {

    private static final Logger LOG = LogManager.getLogger(SessionSummaryLog.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    static final List<String> COLUMNS;

    static {
        List<String> columns = new ArrayList<>(List.of("timestamp", "username", "action", "status",
                "duration_minutes"));
        for (EventKind kind : EventKind.values()) {
            columns.add(kind.summaryColumn());
        }
        columns.addAll(List.of("tags", "notes", "error_message"));
        COLUMNS = List.copyOf(columns);
    }

    private final Path directory;
    private final CsvMapper mapper;
    private final Clock clock;
    private final CsvSchema schema = CsvEventSink.schemaFor(COLUMNS);

    public SessionSummaryLog(Path directory, CsvMapper mapper, Clock clock) {
        this.directory = directory;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @return today's log file
     */
    public Path currentFile() {
        String day = LocalDateTime.ofInstant(clock.instant(), zone()).format(DAY);
        return directory.resolve("monitoring_sessions_" + day + ".csv");
    }

    /**
     * Appends one record, creating today's file with its header if needed.
     */
    public synchronized void append(SummaryRecord record) {
        Path file = currentFile();
        try {
            Files.createDirectories(directory);
            StringBuilder text = new StringBuilder();
            if (!Files.exists(file) || Files.size(file) == 0) {
                text.append(String.join(",", COLUMNS)).append('\n');
            }
            text.append(mapper.writer(schema).writeValueAsString(toRow(record)));
            Files.writeString(file, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.error("Failed to append session summary for {} to {}: {}", record.username(), file, e.toString());
        }
    }

    private Map<String, Object> toRow(SummaryRecord r) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", LocalDateTime.ofInstant(r.at(), zone()).toString());
        row.put("username", r.username());
        row.put("action", r.action());
        row.put("status", r.status());
        row.put("duration_minutes", Math.round(r.durationMinutes() * 100.0) / 100.0);
        for (EventKind kind : EventKind.values()) {
            row.put(kind.summaryColumn(), r.count(kind));
        }
        row.put("tags", String.join(";", r.tags()));
        row.put("notes", r.notes());
        row.put("error_message", r.errorMessage());
        return row;
    }

    private ZoneId zone() {
        return clock.getZone();
    }
}
