package com.example.forecast.model;

/**
 * Affine transform applied by preprocessing; forecasts are mapped back with {@link #denormalize(double)}.
 *
 * @param mean  subtracted location
 * @param scale divisor, strictly positive
 */
public record Normalization(double mean, double scale) {

    public Normalization {
        if (!Double.isFinite(mean) || !Double.isFinite(scale) || scale <= 0.0) {
            throw new IllegalArgumentException("Invalid normalization (mean=%s, scale=%s)".formatted(mean, scale));
        }
    }

    public double normalize(double value) {
        return (value - mean) / scale;
    }

    public double denormalize(double value) {
        return value * scale + mean;
    }
}
