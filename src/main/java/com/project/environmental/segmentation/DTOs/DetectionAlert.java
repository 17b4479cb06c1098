package com.project.environmental.segmentation.DTOs;

public record DetectionAlert(
        String alertType,
        String severity,
        String title,
        String message,
        PixelPoint coordinates,
        int affectedArea,
        double confidence
) {}
