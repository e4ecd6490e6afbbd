package com.phillippitts.streamwatch.client.event;

/**
 * Viewer attached to an interaction event. Fields may be empty when the platform omits them.
 */
public record LiveUser(String uniqueId, String nickname, long followerCount) {

    public static final LiveUser UNKNOWN = new LiveUser("", "", 0);

    public LiveUser {
        uniqueId = uniqueId == null ? "" : uniqueId;
        nickname = nickname == null ? "" : nickname;
    }
}
