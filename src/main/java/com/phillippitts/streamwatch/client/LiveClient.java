package com.phillippitts.streamwatch.client;

import com.phillippitts.streamwatch.client.event.LiveEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Connection to one streamer's live broadcast.
 *
 * <p>This is the seam to the external live-stream protocol client. A client is created per probe
 * or per recording session by a {@link LiveClientFactory}; it is not reused across sessions.
 *
 * <p><b>Threading:</b> events are delivered to the registered {@link LiveEventListener} on the
 * client's own threads, in arrival order for this connection.
 */
public interface LiveClient {

    /**
     * @return the streamer this client targets (e.g. {@code @name})
     */
    String username();

    /**
     * Asynchronously asks the platform whether the streamer is currently broadcasting.
     *
     * @return future completing with the on-air status, or exceptionally on transport failure
     */
    CompletableFuture<Boolean> isLive();

    /**
     * Connects to the broadcast and starts delivering events to {@code listener}.
     * Blocks until the connection is established.
     *
     * @param listener receiver for all typed events of this connection
     * @throws com.phillippitts.streamwatch.exception.LiveClientException if the connection fails
     */
    void connect(LiveEventListener listener);

    /**
     * Closes the connection.
     *
     * @return future completing once the connection is closed
     */
    CompletableFuture<Void> disconnect();

    boolean isConnected();

    /**
     * @return platform room identifier once connected, otherwise {@code null}
     */
    String roomId();

    /**
     * @return media capture backend for this connection
     */
    MediaCapture mediaCapture();
}
