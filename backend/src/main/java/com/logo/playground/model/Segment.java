package com.logo.playground.model;

public record Segment(
        Point start,
        Point end,
        double heading,
        RgbColor color,
        double lineWidth,
        String turtleId) {

    public double length() {
        return start.distanceTo(end);
    }
}
