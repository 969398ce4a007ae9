package com.plainer.collab.client.ui;

/**
 * A region whose pointer movements can be observed, such as a canvas or an editor pane. Coordinates
 * are relative to the region.
 */
public interface PointerSurface {

    String id();

    void addPointerListener(PointerListener listener);

    void removePointerListener(PointerListener listener);
}
