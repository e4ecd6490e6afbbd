package com.phillippitts.streamwatch.persistence;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Append-only destination for one kind of captured event.
 */
public interface EventSink extends Closeable {

    /**
     * Appends one record. Keys are column names; missing columns are written empty.
     *
     * @throws IOException if the record cannot be written
     */
    void write(Map<String, Object> row) throws IOException;

    Path path();

    /**
     * Closes the sink. Calling close more than once has no effect.
     */
    @Override
    void close() throws IOException;
}
