package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.client.event.CommentEvent;
import com.phillippitts.streamwatch.client.event.ConnectEvent;
import com.phillippitts.streamwatch.client.event.DisconnectEvent;
import com.phillippitts.streamwatch.client.event.FollowEvent;
import com.phillippitts.streamwatch.client.event.GiftEvent;
import com.phillippitts.streamwatch.client.event.JoinEvent;
import com.phillippitts.streamwatch.client.event.LikeEvent;
import com.phillippitts.streamwatch.client.event.LiveEventListener;
import com.phillippitts.streamwatch.client.event.LiveUser;
import com.phillippitts.streamwatch.client.event.ShareEvent;
import com.phillippitts.streamwatch.client.event.StreamEndEvent;
import com.phillippitts.streamwatch.persistence.EventKind;
import com.phillippitts.streamwatch.persistence.EventSink;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.recording.event.StreamDisconnectedEvent;
import com.phillippitts.streamwatch.service.recording.event.StreamEndedEvent;
import com.phillippitts.streamwatch.service.recording.event.StreamReconnectedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event handler registered once per {@link RecordingSession}.
 *
 * <p>Interaction events are counted and appended to the session's sink for their kind, but only
 * while the session is recording; the check is repeated for every event. A failed write is
 * logged and the session carries on.
 *
 * <p>Connection events are translated into application events ({@link StreamDisconnectedEvent},
 * {@link StreamEndedEvent}, {@link StreamReconnectedEvent}) for the disconnect-confirmation logic.
 */
public class SessionEventRecorder implements LiveEventListener {

    private static final Logger LOG = LogManager.getLogger(SessionEventRecorder.class);

    private final RecordingSession session;
    private final ApplicationEventPublisher publisher;
    private final MonitorMetrics metrics;
    private final Clock clock;

    public SessionEventRecorder(RecordingSession session,
                                ApplicationEventPublisher publisher,
                                MonitorMetrics metrics,
                                Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? MonitorMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onConnect(ConnectEvent event) {
        if (!session.isRecording()) {
            return;
        }
        LOG.info("Connected to {} (room {})", session.username(), event.roomId());
        publisher.publishEvent(new StreamReconnectedEvent(session.username(), at(event.at()), event.roomId()));
    }

    @Override
    public void onDisconnect(DisconnectEvent event) {
        if (!session.isRecording()) {
            return;
        }
        LOG.info("Disconnected from {}: {}", session.username(), text(event.reason()));
        publisher.publishEvent(new StreamDisconnectedEvent(session.username(), at(event.at()), text(event.reason())));
    }

    @Override
    public void onStreamEnd(StreamEndEvent event) {
        if (!session.isRecording()) {
            return;
        }
        LOG.info("Stream ended for {}: {}", session.username(), text(event.reason()));
        publisher.publishEvent(new StreamEndedEvent(session.username(), at(event.at()), text(event.reason())));
    }

    @Override
    public void onComment(CommentEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("comment", text(e.comment()));
        row.put("follower_count", user(e.user()).followerCount());
        write(EventKind.CHAT, row);
    }

    @Override
    public void onGift(GiftEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("gift_name", text(e.giftName()));
        row.put("repeat_count", e.repeatCount());
        row.put("streakable", e.streakable());
        row.put("streaking", e.streaking());
        write(EventKind.GIFT, row);
    }

    @Override
    public void onFollow(FollowEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("follow_count", e.followCount());
        row.put("share_type", e.shareType());
        row.put("action", e.action());
        write(EventKind.FOLLOW, row);
    }

    @Override
    public void onShare(ShareEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("share_type", e.shareType());
        row.put("share_target", text(e.shareTarget()));
        row.put("share_count", e.shareCount());
        row.put("users_joined", e.usersJoined());
        row.put("action", e.action());
        write(EventKind.SHARE, row);
    }

    @Override
    public void onJoin(JoinEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("count", e.count());
        row.put("is_top_user", e.topUser());
        row.put("enter_type", e.enterType());
        row.put("action", e.action());
        row.put("user_share_type", text(e.userShareType()));
        row.put("client_enter_source", text(e.clientEnterSource()));
        write(EventKind.JOIN, row);
    }

    @Override
    public void onLike(LikeEvent e) {
        Map<String, Object> row = base(e.at(), e.user());
        row.put("count", e.count());
        row.put("total", e.total());
        write(EventKind.LIKE, row);
    }

    private void write(EventKind kind, Map<String, Object> row) {
        if (!session.isRecording()) {
            LOG.trace("Dropping {} event for {}: session {}", kind, session.username(), session.state());
            return;
        }
        session.increment(kind);
        metrics.incrementEvent(kind);
        EventSink sink = session.sinks().sink(kind);
        ThreadContext.put("streamer", session.username());
        try {
            sink.write(row);
        } catch (IOException | RuntimeException e) {
            if (session.isRecording()) {
                LOG.warn("Failed to write {} event for {} to {}: {}", kind, session.username(),
                        sink.path(), e.toString());
            } else {
                LOG.debug("Write of {} event for {} failed during teardown: {}", kind, session.username(),
                        e.toString());
            }
        } finally {
            ThreadContext.remove("streamer");
        }
    }

    private Map<String, Object> base(Instant at, LiveUser user) {
        LiveUser u = user(user);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", LocalDateTime.ofInstant(at(at), clock.getZone()).toString());
        row.put("user_id", u.uniqueId());
        row.put("nickname", u.nickname());
        return row;
    }

    private Instant at(Instant at) {
        return at == null ? clock.instant() : at;
    }

    private static LiveUser user(LiveUser user) {
        return user == null ? LiveUser.UNKNOWN : user;
    }

    private static String text(String s) {
        return s == null ? "" : s;
    }
}
