package com.logo.playground.model;

public record Bounds(double x, double y, double width, double height) {

    public static final Bounds DEFAULT = new Bounds(-50, -50, 100, 100);

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    public boolean contains(Point point) {
        return point.x() >= x && point.x() <= maxX()
                && point.y() >= y && point.y() <= maxY();
    }
}
