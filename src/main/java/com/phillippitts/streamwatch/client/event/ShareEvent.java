package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

public record ShareEvent(Instant at,
                         LiveUser user,
                         int shareType,
                         String shareTarget,
                         long shareCount,
                         long usersJoined,
                         int action) implements LiveEvent {
}
