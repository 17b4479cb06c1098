package com.project.environmental.segmentation.DTOs;

import java.util.Map;

public record DetectionSummary(
        int totalDetections,
        Map<String, Integer> byType,
        int criticalDetections,
        int highRiskDetections
) {}
