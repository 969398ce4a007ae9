package com.plainer.collab.room;

import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.model.Role;

public record JoinResult(boolean accepted, Role role, RoomSnapshot snapshot, String resumeToken, String code, String reason) {

    public static JoinResult accepted(Role role, RoomSnapshot snapshot, String resumeToken) {
        return new JoinResult(true, role, snapshot, resumeToken, null, null);
    }

    public static JoinResult rejected(String code, String reason) {
        return new JoinResult(false, null, null, null, code, reason);
    }
}
