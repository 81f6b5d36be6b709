package com.example.scenebrain_backend.selector;

import java.util.List;

/**
 * Six-dimensional brand personality. Every dimension is clamped to {@code [0,1]} on construction.
 */
public record ProfileVector(double corporate,
                            double minimalist,
                            double playful,
                            double technical,
                            double bold,
                            double modern) {

    public static final int DIMENSIONS = 6;

    public ProfileVector {
        corporate = clamp(corporate);
        minimalist = clamp(minimalist);
        playful = clamp(playful);
        technical = clamp(technical);
        bold = clamp(bold);
        modern = clamp(modern);
    }

    public static ProfileVector neutral() {
        return new ProfileVector(0.5, 0.5, 0.5, 0.5, 0.5, 0.5);
    }

    public static ProfileVector of(double... values) {
        if (values == null || values.length != DIMENSIONS) {
            throw new IllegalArgumentException("Profile vector needs exactly " + DIMENSIONS + " values");
        }
        return new ProfileVector(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    public static ProfileVector of(List<Double> values) {
        if (values == null || values.size() != DIMENSIONS) {
            throw new IllegalArgumentException("Profile vector needs exactly " + DIMENSIONS + " values");
        }
        return new ProfileVector(values.get(0), values.get(1), values.get(2), values.get(3), values.get(4), values.get(5));
    }

    public double[] toArray() {
        return new double[]{corporate, minimalist, playful, technical, bold, modern};
    }

    /**
     * Mean absolute difference across all dimensions, in {@code [0,1]}.
     */
    public double meanDistance(ProfileVector other) {
        double[] a = toArray();
        double[] b = other.toArray();
        double sum = 0.0;
        for (int i = 0; i < DIMENSIONS; i++) {
            sum += Math.abs(a[i] - b[i]);
        }
        return sum / DIMENSIONS;
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
