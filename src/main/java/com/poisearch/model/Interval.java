package com.poisearch.model;

import lombok.Value;

/**
 * Closed interval [min, max]
 */
@Value
public class Interval {

    double min;
    double max;

    public static Interval of(double min, double max) {
        return new Interval(min, max);
    }

    public boolean isWellFormed() {
        return !Double.isNaN(min) && !Double.isNaN(max) && min <= max;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
