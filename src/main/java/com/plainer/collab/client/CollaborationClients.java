package com.plainer.collab.client;

import com.plainer.collab.client.content.MergeFunction;
import com.plainer.collab.client.transport.ConnectionTransport;
import com.plainer.collab.client.transport.QuarkusChannelFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.Map;

/**
 * Builds {@link CollaborationManager}s wired to the configured endpoint. Each manager owns one
 * connection and must be closed by its caller.
 */
@ApplicationScoped
public class CollaborationClients {

    @Inject
    ClientSettings settings;

    @Inject
    QuarkusChannelFactory channels;

    @Inject
    Clock clock;

    public CollaborationManager newManager() {
        return newManager(Map.of());
    }

    public CollaborationManager newManager(Map<String, MergeFunction> mergeFunctions) {
        return new CollaborationManager(settings, new ConnectionTransport(settings, channels), clock, mergeFunctions);
    }
}
