package com.plainer.collab.client.transport;

/** Credentials presented on every (re)join. */
public record JoinOptions(String password, String inviteToken, String bearerToken) {

    public static final JoinOptions NONE = new JoinOptions(null, null, null);

    public static JoinOptions password(String password) {
        return new JoinOptions(password, null, null);
    }

    public static JoinOptions invite(String inviteToken) {
        return new JoinOptions(null, inviteToken, null);
    }
}
