package com.plainer.collab.error;

/** The request was valid but collides with current room state. Nothing was mutated. */
public class ConflictException extends CollaborationException {

    public static final String LOCKED = "locked";
    public static final String LOCK_NOT_HELD = "lock_not_held";
    public static final String LOCK_NOT_OWNED = "lock_not_owned";
    public static final String MEMBER_NOT_FOUND = "member_not_found";
    public static final String COMMENT_NOT_FOUND = "comment_not_found";
    public static final String MESSAGE_NOT_FOUND = "message_not_found";
    public static final String ROOM_EXISTS = "room_exists";
    public static final String SELF_TARGET = "self_target";
    public static final String NOT_JOINED = "not_joined";

    public ConflictException(String code, String message) {
        super(code, 409, message);
    }

    protected ConflictException(String code, int httpStatus, String message) {
        super(code, httpStatus, message);
    }
}
