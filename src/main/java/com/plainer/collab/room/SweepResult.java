package com.plainer.collab.room;

public record SweepResult(int membersMarkedOffline, int membersPurged, int locksExpired, int roomsRemoved) {

    public static final SweepResult EMPTY = new SweepResult(0, 0, 0, 0);

    public SweepResult plus(SweepResult other) {
        return new SweepResult(
            membersMarkedOffline + other.membersMarkedOffline,
            membersPurged + other.membersPurged,
            locksExpired + other.locksExpired,
            roomsRemoved + other.roomsRemoved);
    }

    public boolean isEmpty() {
        return membersMarkedOffline == 0 && membersPurged == 0 && locksExpired == 0 && roomsRemoved == 0;
    }
}
