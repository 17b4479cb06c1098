package com.project.environmental.segmentation.service.detection;

/**
 * Whole-image confidence as a saturating function of the detection count:
 * {@code min(cap, count * slope + base)}, or {@code whenEmpty} without detections.
 */
public record AggregateConfidence(double slope, double base, double cap, double whenEmpty) {

    /** Used when all six detectors run together. */
    public static final AggregateConfidence GENERAL = new AggregateConfidence(8, 50, 90, 35);

    public double forCount(int count) {
        if (count <= 0) {
            return whenEmpty;
        }
        return Math.min(cap, count * slope + base);
    }
}
