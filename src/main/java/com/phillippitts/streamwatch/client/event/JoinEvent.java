package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Viewer joined the broadcast.
 */
public record JoinEvent(Instant at,
                        LiveUser user,
                        long count,
                        boolean topUser,
                        int enterType,
                        int action,
                        String userShareType,
                        String clientEnterSource) implements LiveEvent {
}
