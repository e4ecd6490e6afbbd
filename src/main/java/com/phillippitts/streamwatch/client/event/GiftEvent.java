package com.phillippitts.streamwatch.client.event;

import java.time.Instant;

/**
 * Gift sent to the streamer. Streakable gifts arrive repeatedly while {@code streaking} is true.
 */
public record GiftEvent(Instant at,
                        LiveUser user,
                        String giftName,
                        int repeatCount,
                        boolean streakable,
                        boolean streaking) implements LiveEvent {
}
