package com.plainer.collab.room;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

@ApplicationScoped
public class RoomSweeper {

    private static final Logger LOG = Logger.getLogger(RoomSweeper.class);

    @Inject RoomRegistry registry;

    @Scheduled(
            every = "${collab.server.sweep-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweepRooms() {
        SweepResult result = registry.sweep();
        if (result.isEmpty()) {
            return;
        }
        LOG.infof(
                "Sweep marked %d members offline, purged %d members, expired %d locks, removed %d rooms",
                result.membersMarkedOffline(),
                result.membersPurged(),
                result.locksExpired(),
                result.roomsRemoved());
    }
}
