package com.plainer.collab.message;

import com.plainer.collab.model.Role;

import java.time.Instant;

public record MemberView(
    String id,
    String name,
    String color,
    Role role,
    boolean online,
    Instant lastSeen,
    CursorPosition cursor
) {

    public MemberView(String id, String name, String color, Role role, boolean online, Instant lastSeen) {
        this(id, name, color, role, online, lastSeen, null);
    }

    public MemberView withOnline(boolean value, Instant at) {
        return new MemberView(id, name, color, role, value, at, value ? cursor : null);
    }

    public MemberView withRole(Role newRole) {
        return new MemberView(id, name, color, newRole, online, lastSeen, cursor);
    }
}
