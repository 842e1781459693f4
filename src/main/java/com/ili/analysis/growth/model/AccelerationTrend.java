package com.ili.analysis.growth.model;

/**
 * Direction of change between the two most recent interval growth rates.
 */
public enum AccelerationTrend {
    ACCELERATING("accelerating"),
    DECELERATING("decelerating"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient data");

    private final String label;

    AccelerationTrend(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
