package com.plainer.collab.error;

public class RoomNotFoundException extends ConflictException {

    public static final String ROOM_NOT_FOUND = "room_not_found";

    public RoomNotFoundException(String roomId) {
        this(ROOM_NOT_FOUND, "Room not found: " + roomId);
    }

    private RoomNotFoundException(String code, String message) {
        super(code, 404, message);
    }

    /** Rebuilds the exception from a server error frame, keeping its message as sent. */
    static RoomNotFoundException withMessage(String message) {
        return new RoomNotFoundException(ROOM_NOT_FOUND, message);
    }
}
