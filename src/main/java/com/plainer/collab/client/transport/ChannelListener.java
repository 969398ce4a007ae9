package com.plainer.collab.client.transport;

// Callbacks may arrive on any thread.
public interface ChannelListener {

    void onText(String text);

    /** The connection closed or failed. Called at most once per channel in practice, but tolerated more. */
    void onClosed(String reason);
}
