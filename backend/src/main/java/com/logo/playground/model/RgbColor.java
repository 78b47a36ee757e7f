package com.logo.playground.model;

public record RgbColor(double red, double green, double blue) {

    public static final RgbColor BLUE = new RgbColor(0, 0, 1);

    public static RgbColor fromBytes(double red, double green, double blue) {
        return new RgbColor(normalize(red), normalize(green), normalize(blue));
    }

    private static double normalize(double channel) {
        return Math.max(0, Math.min(255, channel)) / 255.0;
    }
}
