package com.phillippitts.streamwatch.persistence;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * {@link EventSink} writing one CSV row per record with Jackson's CSV dataformat.
 *
 * <p>The header row is written when the file is created (or empty), so a session without events
 * still leaves a well-formed file. Every row is flushed as it is written.
 *
 * <p><b>Thread Safety:</b> writes and close are synchronized; rows from one session are appended
 * in call order.
 */
public final class CsvEventSink implements EventSink {

    private final Path path;
    private final BufferedWriter out;
    private final SequenceWriter rows;
    private boolean closed;

    public CsvEventSink(Path path, List<String> columns, CsvMapper mapper) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        boolean needsHeader = !Files.exists(path) || Files.size(path) == 0;
        this.out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        try {
            if (needsHeader) {
                out.write(String.join(",", columns));
                out.write('\n');
                out.flush();
            }
            CsvSchema schema = schemaFor(columns);
            this.rows = mapper.writer(schema).writeValues(out);
        } catch (IOException e) {
            out.close();
            throw e;
        }
    }

    static CsvSchema schemaFor(List<String> columns) {
        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        return builder.build().withoutHeader();
    }

    @Override
    public synchronized void write(Map<String, Object> row) throws IOException {
        if (closed) {
            throw new IOException("Sink already closed: " + path);
        }
        rows.write(row);
        rows.flush();
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            rows.close();
        } finally {
            out.close();
        }
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
