package com.phillippitts.streamwatch.client;

/**
 * Creates {@link LiveClient} instances for a streamer with resolved credentials.
 *
 * <p>Provide an implementation as a Spring bean to connect StreamWatch to a real platform. When
 * none is present {@link OfflineLiveClientFactory} is installed.
 */
@FunctionalInterface
public interface LiveClientFactory {

    LiveClient create(String username, Credentials credentials);
}
