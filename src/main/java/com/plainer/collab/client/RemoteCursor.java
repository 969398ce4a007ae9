package com.plainer.collab.client;

import java.time.Instant;

public record RemoteCursor(
    String userId,
    String name,
    String color,
    double x,
    double y,
    String elementId,
    Instant updatedAt
) {}
