package com.phillippitts.streamwatch.client.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiveEventListenerTest {

    private static final Instant AT = Instant.EPOCH;

    private static class Recording implements LiveEventListener {
        final List<String> calls = new ArrayList<>();

        @Override
        public void onComment(CommentEvent event) {
            calls.add("comment");
        }

        @Override
        public void onGift(GiftEvent event) {
            calls.add("gift");
        }

        @Override
        public void onStreamEnd(StreamEndEvent event) {
            calls.add("end");
        }

        @Override
        public void onDisconnect(DisconnectEvent event) {
            calls.add("disconnect");
        }
    }

    @Test
    void shouldRouteEachEventToItsHandler() {
        Recording listener = new Recording();

        LiveEventListener.route(new CommentEvent(AT, LiveUser.UNKNOWN, "hi"), listener);
        LiveEventListener.route(new GiftEvent(AT, LiveUser.UNKNOWN, "Rose", 1, false, false), listener);
        LiveEventListener.route(new DisconnectEvent(AT, "network"), listener);
        LiveEventListener.route(new StreamEndEvent(AT, "ended"), listener);

        assertThat(listener.calls).containsExactly("comment", "gift", "disconnect", "end");
    }

    @Test
    void unhandledKindsFallBackToNoOpDefaults() {
        Recording listener = new Recording();

        boolean delivered = LiveEventListener.route(new LikeEvent(AT, LiveUser.UNKNOWN, 5, 100), listener);

        assertThat(delivered).isTrue();
        assertThat(listener.calls).isEmpty();
    }

    @Test
    void unknownOrNullEventsAreNotDelivered() {
        Recording listener = new Recording();
        LiveEvent custom = () -> AT;

        assertThat(LiveEventListener.route(custom, listener)).isFalse();
        assertThat(LiveEventListener.route(null, listener)).isFalse();
        assertThat(listener.calls).isEmpty();
    }

    @Test
    void liveUserNormalizesMissingFields() {
        LiveUser user = new LiveUser(null, null, 3);

        assertThat(user.uniqueId()).isEmpty();
        assertThat(user.nickname()).isEmpty();
    }
}
