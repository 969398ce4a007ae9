package com.plainer.collab.client.content;

import com.plainer.collab.error.ApplyException;
import com.plainer.collab.message.ContentChange;

/**
 * Applies a single {@link ContentChange} to a string. The position is clamped to the current
 * length, and the number of removed characters never runs past the end of the text.
 */
public final class ContentChanges {

    private ContentChanges() {}

    public static String apply(String text, ContentChange change) {
        if (change == null || change.type() == null) {
            throw new ApplyException(ApplyException.INVALID_CHANGE, "Change has no type");
        }
        String current = text != null ? text : "";
        int pos = clamp(change.position(), current.length());
        String content = change.content() != null ? change.content() : "";
        int removed = Math.min(change.removedLength(), current.length() - pos);

        return switch (change.type()) {
            case INSERT -> current.substring(0, pos) + content + current.substring(pos);
            case DELETE -> current.substring(0, pos) + current.substring(pos + removed);
            case REPLACE -> current.substring(0, pos) + content + current.substring(pos + removed);
        };
    }

    static int clamp(int position, int length) {
        if (position < 0) return 0;
        return Math.min(position, length);
    }
}
