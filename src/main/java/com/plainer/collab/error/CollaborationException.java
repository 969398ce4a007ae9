package com.plainer.collab.error;

/**
 * Base of every failure the collaboration engine reports. Carries a stable error code and the HTTP
 * status the room management API answers with, so the WebSocket and REST layers can forward errors
 * without branching on types.
 */
public abstract class CollaborationException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    protected CollaborationException(String code, int httpStatus, String message) {
        this(code, httpStatus, message, null);
    }

    protected CollaborationException(String code, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Rebuilds a typed exception from an {@code error} frame received over the wire.
     */
    public static CollaborationException fromCode(String code, String message) {
        if (code == null) {
            return new ProtocolException(ProtocolException.MALFORMED, message);
        }
        return switch (code) {
            case AuthorizationException.AUTHENTICATION_REQUIRED,
                    AuthorizationException.PASSWORD_REQUIRED,
                    AuthorizationException.INVALID_PASSWORD,
                    AuthorizationException.INVITE_REQUIRED,
                    AuthorizationException.INVALID_INVITE,
                    AuthorizationException.FORBIDDEN,
                    AuthorizationException.OWNER_REQUIRED -> new AuthorizationException(code, message);
            case RoomNotFoundException.ROOM_NOT_FOUND -> RoomNotFoundException.withMessage(message);
            case ProtocolException.MALFORMED, ProtocolException.UNKNOWN_TYPE, ProtocolException.INVALID ->
                    new ProtocolException(code, message);
            case ConnectionException.NOT_CONNECTED,
                    ConnectionException.TIMEOUT,
                    ConnectionException.UNREACHABLE,
                    ConnectionException.CLOSED -> new ConnectionException(code, message);
            default -> new ConflictException(code, message);
        };
    }
}
