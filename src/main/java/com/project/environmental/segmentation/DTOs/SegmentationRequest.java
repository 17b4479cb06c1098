package com.project.environmental.segmentation.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Invocation arguments: source image, directory for the annotated result and the
 * requested phenomenon class ({@code general} when absent).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentationRequest(
        String imagePath,
        String outputDir,
        String modelType
) {}
