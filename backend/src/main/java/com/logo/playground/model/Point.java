package com.logo.playground.model;

public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
