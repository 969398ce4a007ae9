package com.plainer.collab.message;

public record CursorPosition(double x, double y, String elementId) {

    public static final CursorPosition OUTSIDE = new CursorPosition(-1, -1, null);

    public boolean isOutside() {
        return x < 0 || y < 0;
    }
}
