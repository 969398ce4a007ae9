package com.plainer.collab.message;

import java.util.List;

/** Full room state handed to a client on (re)join. The only resynchronisation mechanism. */
public record RoomSnapshot(
    String roomId,
    List<MemberView> members,
    List<LockView> locks,
    List<CommentView> comments,
    List<ChatMessageView> chat,
    boolean passwordProtected,
    boolean inviteOnly
) {

    public RoomSnapshot(String roomId, List<MemberView> members, List<LockView> locks, List<CommentView> comments,
                        boolean passwordProtected, boolean inviteOnly) {
        this(roomId, members, locks, comments, List.of(), passwordProtected, inviteOnly);
    }
}
