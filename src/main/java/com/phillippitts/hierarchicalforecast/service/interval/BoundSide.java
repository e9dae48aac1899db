package com.phillippitts.hierarchicalforecast.service.interval;

/**
 * Side of a prediction interval bound.
 */
public enum BoundSide {
    LOWER("lo", -1),
    UPPER("hi", 1);

    private final String marker;
    private final int sign;

    BoundSide(String marker, int sign) {
        this.marker = marker;
        this.sign = sign;
    }

    /** Column-name marker, {@code "lo"} or {@code "hi"}. */
    public String marker() {
        return marker;
    }

    /** -1 for the lower bound, +1 for the upper bound. */
    public int sign() {
        return sign;
    }

    public BoundSide opposite() {
        return this == LOWER ? UPPER : LOWER;
    }
}
