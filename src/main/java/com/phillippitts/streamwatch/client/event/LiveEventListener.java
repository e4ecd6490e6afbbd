package com.phillippitts.streamwatch.client.event;

/**
 * Receiver for the typed event stream of one live connection.
 *
 * <p>One handler method per event kind, each a no-op by default. Clients deliver every event
 * through {@link #route(LiveEvent, LiveEventListener)} so that dispatch happens in exactly one
 * place.
 */
public interface LiveEventListener {

    default void onConnect(ConnectEvent event) {
    }

    default void onDisconnect(DisconnectEvent event) {
    }

    default void onStreamEnd(StreamEndEvent event) {
    }

    default void onComment(CommentEvent event) {
    }

    default void onGift(GiftEvent event) {
    }

    default void onFollow(FollowEvent event) {
    }

    default void onShare(ShareEvent event) {
    }

    default void onJoin(JoinEvent event) {
    }

    default void onLike(LikeEvent event) {
    }

    /**
     * Routes an event to the handler method for its kind.
     *
     * @param event event to deliver (ignored when null)
     * @param listener receiver
     * @return {@code true} if the event kind is known and was delivered
     */
    static boolean route(LiveEvent event, LiveEventListener listener) {
        if (event instanceof CommentEvent e) {
            listener.onComment(e);
        } else if (event instanceof GiftEvent e) {
            listener.onGift(e);
        } else if (event instanceof LikeEvent e) {
            listener.onLike(e);
        } else if (event instanceof JoinEvent e) {
            listener.onJoin(e);
        } else if (event instanceof FollowEvent e) {
            listener.onFollow(e);
        } else if (event instanceof ShareEvent e) {
            listener.onShare(e);
        } else if (event instanceof ConnectEvent e) {
            listener.onConnect(e);
        } else if (event instanceof DisconnectEvent e) {
            listener.onDisconnect(e);
        } else if (event instanceof StreamEndEvent e) {
            listener.onStreamEnd(e);
        } else {
            return false;
        }
        return true;
    }
}
