package com.plainer.collab.error;

/** Unreachable endpoint, handshake timeout or a dropped connection. Retried through backoff. */
public class ConnectionException extends CollaborationException {

    public static final String NOT_CONNECTED = "not_connected";
    public static final String TIMEOUT = "timeout";
    public static final String UNREACHABLE = "unreachable";
    public static final String CLOSED = "closed";

    public ConnectionException(String code, String message) {
        super(code, 503, message);
    }

    public ConnectionException(String code, String message, Throwable cause) {
        super(code, 503, message, cause);
    }
}
