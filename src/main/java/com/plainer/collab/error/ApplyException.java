package com.plainer.collab.error;

/** A received content change could not be applied locally. Logged and dropped, never rethrown. */
public class ApplyException extends CollaborationException {

    public static final String FIELD_NOT_FOUND = "field_not_found";
    public static final String INVALID_CHANGE = "invalid_change";

    public ApplyException(String code, String message) {
        super(code, 422, message);
    }
}
