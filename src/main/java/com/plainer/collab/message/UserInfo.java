package com.plainer.collab.message;

// Identity a client claims when joining.
public record UserInfo(String id, String name, String color) {

    public UserInfo withIdentity(String id, String name) {
        return new UserInfo(id, name, color);
    }
}
