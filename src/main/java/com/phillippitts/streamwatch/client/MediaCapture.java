package com.phillippitts.streamwatch.client;

import java.nio.file.Path;

/**
 * Media capture backend bound to one connected {@link LiveClient}.
 *
 * <p>Implementations write the broadcast's audio/video to a file. Muxing and transcoding are the
 * implementation's concern.
 */
public interface MediaCapture {

    /**
     * Begins writing the broadcast to {@code output}.
     *
     * @param output target media file
     * @throws com.phillippitts.streamwatch.exception.LiveClientException if capture cannot start
     */
    void start(Path output);

    /** Stops writing; no-op when not capturing. */
    void stop();

    boolean isCapturing();

    /**
     * @return file currently (or last) written, or {@code null} if capture never started
     */
    Path outputPath();
}
