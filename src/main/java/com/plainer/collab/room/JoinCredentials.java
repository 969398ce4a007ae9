package com.plainer.collab.room;

/**
 * What a joining client presents.
 *
 * @param resumeToken token from an earlier {@code room-joined}, proves the caller is that member
 * @param verified the user id comes from a validated bearer token rather than the client's claim
 */
public record JoinCredentials(String password, String inviteToken, String resumeToken, boolean verified) {

    public static final JoinCredentials NONE = new JoinCredentials(null, null);

    public JoinCredentials(String password, String inviteToken) {
        this(password, inviteToken, null, false);
    }

    public boolean hasInvite() {
        return inviteToken != null && !inviteToken.isBlank();
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    public boolean hasResumeToken() {
        return resumeToken != null && !resumeToken.isBlank();
    }
}
