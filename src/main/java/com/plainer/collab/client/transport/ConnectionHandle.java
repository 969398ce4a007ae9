package com.plainer.collab.client.transport;

import com.plainer.collab.message.RoomSnapshot;
import com.plainer.collab.message.UserInfo;
import com.plainer.collab.model.Role;

// Result of an accepted handshake.
public record ConnectionHandle(String roomId, UserInfo user, Role role, RoomSnapshot snapshot) {}
