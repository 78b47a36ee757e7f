package com.logo.playground.interpreter;

import com.logo.playground.model.Point;
import com.logo.playground.model.RgbColor;
import com.logo.playground.model.TurtleState;

final class Turtle {

    private final String id;
    private Point position;
    private double heading;
    private boolean penDown;
    private RgbColor penColor;
    private double lineWidth;

    Turtle(String id, TurtleState state) {
        this.id = id;
        this.position = state.position();
        this.heading = state.heading();
        this.penDown = state.penDown();
        this.penColor = state.penColor();
        this.lineWidth = state.lineWidth();
    }

    String id() {
        return id;
    }

    Point position() {
        return position;
    }

    void setPosition(Point position) {
        this.position = position;
    }

    double heading() {
        return heading;
    }

    void setHeading(double heading) {
        this.heading = heading;
    }

    void turn(double degrees) {
        heading += degrees;
    }

    boolean isPenDown() {
        return penDown;
    }

    void setPenDown(boolean penDown) {
        this.penDown = penDown;
    }

    RgbColor penColor() {
        return penColor;
    }

    void setPenColor(RgbColor penColor) {
        this.penColor = penColor;
    }

    double lineWidth() {
        return lineWidth;
    }

    /**
     * Point reached by moving {@code distance} along the current heading.
     * Heading 0 is +Y, so x uses sine and y uses cosine.
     */
    Point destination(double distance) {
        double radians = Math.toRadians(heading);
        return position.translate(Math.sin(radians) * distance, Math.cos(radians) * distance);
    }

    void resetPose() {
        position = Point.ORIGIN;
        heading = 0;
    }

    TurtleState snapshot() {
        return new TurtleState(position, heading, penDown, penColor, lineWidth);
    }
}
