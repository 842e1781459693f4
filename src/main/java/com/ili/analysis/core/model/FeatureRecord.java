package com.ili.analysis.core.model;

import java.util.Objects;

/**
 * One detected pipeline feature in one survey, in the canonical schema.
 * Optional measurements are {@code null} when the vendor did not report them.
 *
 * <p>Records are never mutated; alignment produces a copy carrying
 * {@code correctedDistance} via {@link #withCorrectedDistance(double)}.</p>
 *
 * @param runId             survey identifier
 * @param featureId         identifier unique within the run
 * @param distance          distance along the pipeline in feet (non-negative)
 * @param jointNumber       pipe joint number, if reported
 * @param relativePosition  distance from the nearest upstream weld in feet, if reported
 * @param clockDeg          clock position in degrees [0, 360), 0 = 12 o'clock, if reported
 * @param category          normalized feature category
 * @param orientation       wall surface
 * @param depthPct          depth as percent of wall thickness, if reported
 * @param lengthIn          length in inches, if reported
 * @param widthIn           width in inches, if reported
 * @param wallThicknessIn   wall thickness in inches, if reported
 * @param correctedDistance distance after alignment into the reference run's frame, if aligned
 */
public record FeatureRecord(
        String runId,
        String featureId,
        double distance,
        Integer jointNumber,
        Double relativePosition,
        Double clockDeg,
        FeatureCategory category,
        Orientation orientation,
        Double depthPct,
        Double lengthIn,
        Double widthIn,
        Double wallThicknessIn,
        Double correctedDistance
) {
    public FeatureRecord {
        Objects.requireNonNull(featureId, "featureId is required");
        if (Double.isNaN(distance) || distance < 0.0) {
            throw new IllegalArgumentException("distance must be non-negative, got " + distance);
        }
        if (depthPct != null && depthPct < 0.0) {
            throw new IllegalArgumentException("depthPct must be non-negative, got " + depthPct);
        }
        category = category != null ? category : FeatureCategory.UNKNOWN;
        orientation = orientation != null ? orientation : Orientation.UNKNOWN;
    }

    /**
     * Distance used for cross-run comparison: the corrected distance when aligned, else the raw distance.
     */
    public double alignedDistance() {
        return correctedDistance != null ? correctedDistance : distance;
    }

    public boolean isControlPoint() {
        return category.isControlPoint();
    }

    public FeatureRecord withCorrectedDistance(double corrected) {
        return new FeatureRecord(runId, featureId, distance, jointNumber, relativePosition, clockDeg,
                category, orientation, depthPct, lengthIn, widthIn, wallThicknessIn, corrected);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String runId;
        private String featureId;
        private double distance;
        private Integer jointNumber;
        private Double relativePosition;
        private Double clockDeg;
        private FeatureCategory category = FeatureCategory.UNKNOWN;
        private Orientation orientation = Orientation.UNKNOWN;
        private Double depthPct;
        private Double lengthIn;
        private Double widthIn;
        private Double wallThicknessIn;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder featureId(String featureId) {
            this.featureId = featureId;
            return this;
        }

        public Builder distance(double distance) {
            this.distance = distance;
            return this;
        }

        public Builder jointNumber(Integer jointNumber) {
            this.jointNumber = jointNumber;
            return this;
        }

        public Builder relativePosition(Double relativePosition) {
            this.relativePosition = relativePosition;
            return this;
        }

        public Builder clockDeg(Double clockDeg) {
            this.clockDeg = clockDeg;
            return this;
        }

        public Builder category(FeatureCategory category) {
            this.category = category;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder depthPct(Double depthPct) {
            this.depthPct = depthPct;
            return this;
        }

        public Builder lengthIn(Double lengthIn) {
            this.lengthIn = lengthIn;
            return this;
        }

        public Builder widthIn(Double widthIn) {
            this.widthIn = widthIn;
            return this;
        }

        public Builder wallThicknessIn(Double wallThicknessIn) {
            this.wallThicknessIn = wallThicknessIn;
            return this;
        }

        public FeatureRecord build() {
            return new FeatureRecord(runId, featureId, distance, jointNumber, relativePosition, clockDeg,
                    category, orientation, depthPct, lengthIn, widthIn, wallThicknessIn, null);
        }
    }
}
