package com.phillippitts.streamwatch.client;

import com.phillippitts.streamwatch.client.event.LiveEventListener;
import com.phillippitts.streamwatch.exception.LiveClientException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback factory used when no platform client is configured: every streamer reports offline
 * and connections are refused. Keeps the monitor runnable (status file, config reload, control
 * signals) without a protocol implementation on the classpath.
 */
public class OfflineLiveClientFactory implements LiveClientFactory {

    private static final Logger LOG = LogManager.getLogger(OfflineLiveClientFactory.class);

    public OfflineLiveClientFactory() {
        LOG.warn("No LiveClientFactory bean configured; all streamers will be reported offline");
    }

    @Override
    public LiveClient create(String username, Credentials credentials) {
        return new OfflineClient(username);
    }

    private static final class OfflineClient implements LiveClient, MediaCapture {
        private final String username;

        OfflineClient(String username) {
            this.username = username;
        }

        @Override
        public String username() {
            return username;
        }

        @Override
        public CompletableFuture<Boolean> isLive() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public void connect(LiveEventListener listener) {
            throw new LiveClientException("No live client available for " + username);
        }

        @Override
        public CompletableFuture<Void> disconnect() {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isConnected() {
            return false;
        }

        @Override
        public String roomId() {
            return null;
        }

        @Override
        public MediaCapture mediaCapture() {
            return this;
        }

        @Override
        public void start(Path output) {
            throw new LiveClientException("No media capture available for " + username);
        }

        @Override
        public void stop() {
            // nothing to stop
        }

        @Override
        public boolean isCapturing() {
            return false;
        }

        @Override
        public Path outputPath() {
            return null;
        }
    }
}
