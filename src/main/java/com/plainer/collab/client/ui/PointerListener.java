package com.plainer.collab.client.ui;

public interface PointerListener {

    void moved(double x, double y);

    void left();
}
