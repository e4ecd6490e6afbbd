package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

public record FollowEvent(Instant at, LiveUser user, long followCount, int shareType, int action)
        implements LiveEvent {
}
