package com.plainer.collab.error;

/** Malformed or unknown frame. The frame is dropped; the connection survives isolated ones. */
public class ProtocolException extends CollaborationException {

    public static final String MALFORMED = "malformed";
    public static final String UNKNOWN_TYPE = "unknown_type";
    public static final String INVALID = "invalid";

    public ProtocolException(String code, String message) {
        super(code, 400, message);
    }

    public ProtocolException(String code, String message, Throwable cause) {
        super(code, 400, message, cause);
    }

    public static ProtocolException invalid(String message) {
        return new ProtocolException(INVALID, message);
    }
}
