package com.plainer.collab.client.content;

import com.plainer.collab.message.ChangeType;
import com.plainer.collab.message.ContentChange;

import java.util.Optional;

/**
 * Single-operation diff between two values of one field.
 *
 * <p>The common prefix and suffix are stripped and the remaining middle becomes one insert, delete
 * or replace. When the values share neither prefix nor suffix this degenerates into a replace at
 * position 0 spanning the whole previous value. Boundaries are moved so a surrogate pair is never
 * split.
 */
public final class TextDiff {

    private TextDiff() {}

    /**
     * @return the change turning {@code oldValue} into {@code newValue}, without author or
     *     timestamp, or empty when the values are equal
     */
    public static Optional<ContentChange> diff(String elementId, String oldValue, String newValue) {
        String before = oldValue != null ? oldValue : "";
        String after = newValue != null ? newValue : "";
        if (before.equals(after)) {
            return Optional.empty();
        }

        int max = Math.min(before.length(), after.length());
        int prefix = 0;
        while (prefix < max && before.charAt(prefix) == after.charAt(prefix)) {
            prefix++;
        }
        if (prefix > 0 && Character.isHighSurrogate(before.charAt(prefix - 1))) {
            prefix--;
        }

        int suffix = 0;
        while (suffix < max - prefix
                && before.charAt(before.length() - 1 - suffix) == after.charAt(after.length() - 1 - suffix)) {
            suffix++;
        }
        if (suffix > 0 && Character.isLowSurrogate(before.charAt(before.length() - suffix))) {
            suffix--;
        }

        String removed = before.substring(prefix, before.length() - suffix);
        String inserted = after.substring(prefix, after.length() - suffix);

        if (removed.isEmpty()) {
            return Optional.of(change(elementId, ChangeType.INSERT, prefix, inserted, null));
        }
        if (inserted.isEmpty()) {
            return Optional.of(change(elementId, ChangeType.DELETE, prefix, removed, null));
        }
        Integer length = removed.length() != inserted.length() ? removed.length() : null;
        return Optional.of(change(elementId, ChangeType.REPLACE, prefix, inserted, length));
    }

    private static ContentChange change(String elementId, ChangeType type, int position, String content, Integer length) {
        return new ContentChange(null, elementId, type, position, content, length, null, null);
    }
}
