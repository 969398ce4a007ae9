package com.plainer.collab.room;

import com.plainer.collab.message.CursorPosition;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.model.Role;
import com.plainer.collab.security.CredentialHasher;

import java.time.Instant;

// Mutable member record. Only touched while the owning Room's monitor is held.
final class Member {

    private final String id;
    private final String color;
    private final String resumeToken = CredentialHasher.newToken();
    private String name;
    private Role role;
    private boolean online;
    private Instant lastSeen;
    private MemberChannel channel;
    private CursorPosition cursor;

    Member(String id, String name, String color, Role role) {
        this.id = id;
        this.name = name;
        this.color = color;
        this.role = role;
    }

    void connect(String displayName, MemberChannel newChannel, Instant now) {
        if (displayName != null && !displayName.isBlank()) {
            this.name = displayName;
        }
        this.channel = newChannel;
        this.online = true;
        this.lastSeen = now;
    }

    void goOffline(Instant at) {
        this.online = false;
        this.channel = null;
        this.cursor = null;
        this.lastSeen = at;
    }

    void touch(Instant now) {
        this.lastSeen = now;
    }

    boolean canResumeWith(String token) {
        return CredentialHasher.tokenMatches(token, resumeToken);
    }

    String resumeToken() {
        return resumeToken;
    }

    boolean isCurrentConnection(String connectionId) {
        return channel != null && channel.connectionId().equals(connectionId);
    }

    String id() {
        return id;
    }

    String name() {
        return name;
    }

    String color() {
        return color;
    }

    Role role() {
        return role;
    }

    void role(Role newRole) {
        this.role = newRole;
    }

    boolean isOnline() {
        return online;
    }

    Instant lastSeen() {
        return lastSeen;
    }

    MemberChannel channel() {
        return channel;
    }

    void cursor(CursorPosition position) {
        this.cursor = position;
    }

    CursorPosition cursor() {
        return cursor;
    }

    MemberView toView() {
        return new MemberView(id, name, color, role, online, lastSeen, cursor);
    }
}
