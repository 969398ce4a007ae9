package com.plainer.collab.model;

import java.util.List;

public final class UserColors {

    public static final List<String> PALETTE = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#F9CA24",
        "#F0932B", "#EB4D4B", "#6C5CE7", "#A29BFE",
        "#2D3436", "#00B894", "#FDCB6E", "#E17055"
    );

    private UserColors() {}

    /** Same user always gets the same colour, in every room and on every server. */
    public static String colorFor(String userId) {
        if (userId == null) return PALETTE.get(0);
        return PALETTE.get(Math.floorMod(userId.hashCode(), PALETTE.size()));
    }
}
