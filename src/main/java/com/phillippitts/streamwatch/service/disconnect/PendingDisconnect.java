package com.phillippitts.streamwatch.service.disconnect;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A disconnect awaiting confirmation after the grace period.
 *
 * @param id identity of this pending record, so a stale timer never acts on a newer one
 * @param username streamer whose connection dropped
 * @param since when the disconnect was observed
 * @param reason disconnect reason reported by the client
 * @param dueAt when the confirmation re-probe runs
 * @param task scheduled confirmation; cancelled when the disconnect becomes moot
 */
public record PendingDisconnect(long id,
                                String username,
                                Instant since,
                                String reason,
                                Instant dueAt,
                                ScheduledFuture<?> task) {
}
