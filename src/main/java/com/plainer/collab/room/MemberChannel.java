package com.plainer.collab.room;

import com.plainer.collab.message.ServerMessage;

/**
 * Outbound side of one client connection as the registry sees it. Implementations must not block:
 * the registry sends while holding a room's lock.
 */
public interface MemberChannel {

    String connectionId();

    void send(ServerMessage message);

    void close(String reason);
}
