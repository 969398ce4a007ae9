package com.plainer.collab.message;

/** Values of the {@code type} field of every frame. */
public final class MessageTypes {

    // client -> server
    public static final String JOIN_ROOM = "join-room";
    public static final String LEAVE_ROOM = "leave-room";
    public static final String LOCK_ACQUIRE = "lock-acquire";
    public static final String LOCK_RELEASE = "lock-release";
    public static final String ROLE_CHANGE = "role-change";
    public static final String COMMENT_ADD = "comment-add";
    public static final String COMMENT_UPDATE = "comment-update";
    public static final String COMMENT_DELETE = "comment-delete";
    public static final String COMMENT_RESOLVE = "comment-resolve";
    public static final String REQUEST_PRESENCE = "request-presence";
    public static final String CHAT_SEND = "chat-send";
    public static final String PING = "ping";

    // both directions
    public static final String CURSOR_UPDATE = "cursor-update";
    public static final String CONTENT_CHANGE = "content-change";
    public static final String CHAT_REACTION = "chat-reaction";

    // server -> client
    public static final String ROOM_JOINED = "room-joined";
    public static final String JOIN_REJECTED = "join-rejected";
    public static final String PRESENCE_JOINED = "presence-joined";
    public static final String PRESENCE_LEFT = "presence-left";
    public static final String PRESENCE_UPDATED = "presence-updated";
    public static final String LOCK_GRANTED = "lock-granted";
    public static final String LOCK_DENIED = "lock-denied";
    public static final String LOCK_RELEASED = "lock-released";
    public static final String ROLE_CHANGED = "role-changed";
    public static final String COMMENT_ADDED = "comment-added";
    public static final String COMMENT_UPDATED = "comment-updated";
    public static final String COMMENT_DELETED = "comment-deleted";
    public static final String COMMENT_RESOLVED = "comment-resolved";
    public static final String CHAT_MESSAGE = "chat-message";
    public static final String SESSION_ENDED = "session-ended";
    public static final String ERROR = "error";
    public static final String PONG = "pong";

    private MessageTypes() {}
}
