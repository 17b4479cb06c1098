package com.project.environmental.segmentation.DTOs;

import java.util.Map;

/** Statistics of the detections of one class. */
public record DetectionLayer(
        String layerType,
        int detectionCount,
        double averageConfidence,
        long totalArea,
        Map<String, Integer> severityDistribution
) {}
