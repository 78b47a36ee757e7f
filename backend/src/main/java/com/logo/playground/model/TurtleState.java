package com.logo.playground.model;

/**
 * Snapshot of a turtle's pose and pen. Heading is in degrees, 0 points up and
 * RIGHT turns decrease it.
 */
public record TurtleState(
        Point position,
        double heading,
        boolean penDown,
        RgbColor penColor,
        double lineWidth) {

    public static final TurtleState DEFAULT = new TurtleState(Point.ORIGIN, 0, true, RgbColor.BLUE, 2);
}
