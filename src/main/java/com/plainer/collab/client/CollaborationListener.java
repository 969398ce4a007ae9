package com.plainer.collab.client;

import com.plainer.collab.client.transport.StatusChange;
import com.plainer.collab.message.ChatMessageView;
import com.plainer.collab.message.CommentView;
import com.plainer.collab.message.ContentChange;
import com.plainer.collab.message.LockView;
import com.plainer.collab.message.MemberView;
import com.plainer.collab.model.Role;

import java.util.Collection;
import java.util.List;

/**
 * Reactive view of a {@link CollaborationManager}. Every callback runs on the transport thread;
 * implementations hand off to their UI thread as needed.
 */
public interface CollaborationListener {

    default void onStatusChange(StatusChange change) {}

    default void onUsersChanged(List<MemberView> users) {}

    default void onCursorMoved(RemoteCursor cursor) {}

    default void onCursorRemoved(String userId) {}

    /** A remote change was applied to a registered field, which now holds {@code value}. */
    default void onRemoteChange(ContentChange change, String value) {}

    default void onLocksChanged(Collection<LockView> locks) {}

    default void onCommentsChanged(List<CommentView> comments) {}

    /** A new chat line arrived; {@link #onChatChanged} follows with the whole history. */
    default void onChatMessage(ChatMessageView message) {}

    default void onChatChanged(List<ChatMessageView> messages) {}

    default void onRoleChanged(Role role) {}

    /** An {@code error} frame that did not belong to a pending request. */
    default void onError(String code, String message) {}

    default void onSessionEnded(String code, String reason) {}
}
