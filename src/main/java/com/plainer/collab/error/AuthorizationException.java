package com.plainer.collab.error;

/** Bad credentials or insufficient role. Fatal for the request and never retried. */
public class AuthorizationException extends CollaborationException {

    public static final String AUTHENTICATION_REQUIRED = "authentication_required";
    public static final String PASSWORD_REQUIRED = "password_required";
    public static final String INVALID_PASSWORD = "invalid_password";
    public static final String INVITE_REQUIRED = "invite_required";
    public static final String INVALID_INVITE = "invalid_invite";
    public static final String IDENTITY_UNVERIFIED = "identity_unverified";
    public static final String FORBIDDEN = "forbidden";
    public static final String OWNER_REQUIRED = "owner_required";

    public AuthorizationException(String code, String message) {
        super(code, AUTHENTICATION_REQUIRED.equals(code) ? 401 : 403, message);
    }

    public static AuthorizationException forbidden(String message) {
        return new AuthorizationException(FORBIDDEN, message);
    }

    public static AuthorizationException ownerRequired(String action) {
        return new AuthorizationException(OWNER_REQUIRED, "Only an owner can " + action);
    }
}
