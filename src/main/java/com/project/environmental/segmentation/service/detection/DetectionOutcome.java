package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;

import java.util.List;

/** Detections of one detector run plus the aggregate confidence for the whole image. */
public record DetectionOutcome(List<Detection> detections, double confidence) {
    public DetectionOutcome {
        detections = List.copyOf(detections);
    }
}
