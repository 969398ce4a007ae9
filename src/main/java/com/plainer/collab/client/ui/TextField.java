package com.plainer.collab.client.ui;

import java.util.function.Consumer;

/**
 * An addressable text input. {@link #id()} is the {@code elementId} content changes refer to.
 */
public interface TextField {

    String id();

    String value();

    void setValue(String value);

    void addChangeListener(Consumer<String> listener);

    void removeChangeListener(Consumer<String> listener);
}
