package com.plainer.collab.client.content;

import com.plainer.collab.message.ContentChange;

import java.util.List;
import java.util.Map;
import java.util.Optional;

// Delegates to the merge function registered for the field, else to the fallback.
public class MergeResolver implements ConflictResolver {

    private final Map<String, MergeFunction> functions;
    private final MergeFunction fallback;

    public MergeResolver(Map<String, MergeFunction> functions, MergeFunction fallback) {
        this.functions = functions != null ? Map.copyOf(functions) : Map.of();
        this.fallback = fallback != null ? fallback : MergeFunction.ACCEPT_REMOTE;
    }

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.MERGE;
    }

    @Override
    public Optional<ContentChange> resolve(ContentChange remote, List<ContentChange> concurrentLocal) {
        if (concurrentLocal.isEmpty()) {
            return Optional.of(remote);
        }
        return functions.getOrDefault(remote.elementId(), fallback).merge(List.copyOf(concurrentLocal), remote);
    }
}
