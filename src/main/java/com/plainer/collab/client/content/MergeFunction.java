package com.plainer.collab.client.content;

import com.plainer.collab.message.ContentChange;

import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface MergeFunction {

    MergeFunction ACCEPT_REMOTE = (local, remote) -> Optional.of(remote);

    Optional<ContentChange> merge(List<ContentChange> local, ContentChange remote);
}
