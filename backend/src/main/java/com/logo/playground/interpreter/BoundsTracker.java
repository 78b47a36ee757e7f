package com.logo.playground.interpreter;

import com.logo.playground.model.Bounds;
import com.logo.playground.model.Point;

public final class BoundsTracker {

    private double minX;
    private double maxX;
    private double minY;
    private double maxY;
    private boolean initialized;

    public void register(Point point) {
        if (!initialized) {
            minX = point.x();
            maxX = point.x();
            minY = point.y();
            maxY = point.y();
            initialized = true;
            return;
        }
        minX = Math.min(minX, point.x());
        maxX = Math.max(maxX, point.x());
        minY = Math.min(minY, point.y());
        maxY = Math.max(maxY, point.y());
    }

    public void reset() {
        initialized = false;
        minX = 0;
        maxX = 0;
        minY = 0;
        maxY = 0;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Bounds rect() {
        if (!initialized) {
            return Bounds.DEFAULT;
        }
        return new Bounds(minX, minY, Math.max(1, maxX - minX), Math.max(1, maxY - minY));
    }
}
