package com.project.environmental.segmentation.DTOs;

import java.util.List;

/** A segmentation result together with the analysis derived from its detections. */
public record SegmentationReport(
        SegmentationResult result,
        String environmentalRisk,
        DetectionSummary summary,
        List<DetectionLayer> layers,
        GeoJsonFeatureCollection geoJson,
        List<DetectionAlert> alerts
) {}
