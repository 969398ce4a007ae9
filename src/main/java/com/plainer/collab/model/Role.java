package com.plainer.collab.model;

import com.fasterxml.jackson.annotation.JsonProperty;

// Permission level of a member within a room.
public enum Role {
    @JsonProperty("owner")
    OWNER,
    @JsonProperty("editor")
    EDITOR,
    @JsonProperty("viewer")
    VIEWER;

    public boolean canEdit() {
        return this == EDITOR || this == OWNER;
    }

    public boolean canManage() {
        return this == OWNER;
    }

    public static Role parse(String value, Role fallback) {
        if (value == null || value.isBlank()) return fallback;
        for (Role role : values()) {
            if (role.name().equalsIgnoreCase(value.trim())) return role;
        }
        return fallback;
    }
}
