package com.phillippitts.streamwatch.persistence;

import java.util.List;

/**
 * Kinds of captured interaction events. Each kind gets its own per-session CSV file with a fixed
 * column schema, and its own counter in the session summary.
 */
public enum EventKind {
    CHAT("comments", List.of("timestamp", "user_id", "nickname", "comment", "follower_count")),
    GIFT("gifts", List.of("timestamp", "user_id", "nickname", "gift_name", "repeat_count",
            "streakable", "streaking")),
    FOLLOW("follows", List.of("timestamp", "user_id", "nickname", "follow_count", "share_type", "action")),
    SHARE("shares", List.of("timestamp", "user_id", "nickname", "share_type", "share_target",
            "share_count", "users_joined", "action")),
    JOIN("joins", List.of("timestamp", "user_id", "nickname", "count", "is_top_user", "enter_type",
            "action", "user_share_type", "client_enter_source")),
    LIKE("likes", List.of("timestamp", "user_id", "nickname", "count", "total"));

    private final String fileSuffix;
    private final List<String> columns;

    EventKind(String fileSuffix, List<String> columns) {
        this.fileSuffix = fileSuffix;
        this.columns = columns;
    }

    /**
     * @return suffix used in the per-session file name, e.g. {@code comments}
     */
    public String fileSuffix() {
        return fileSuffix;
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * @return column name of this kind's counter in the session summary log
     */
    public String summaryColumn() {
        return fileSuffix + "_count";
    }
}
