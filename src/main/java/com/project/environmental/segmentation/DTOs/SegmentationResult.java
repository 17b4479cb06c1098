package com.project.environmental.segmentation.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Output of one segmentation run. Failed runs keep the same shape with an {@code error}
 * message, no detections and zeroed measurements.
 */
@JsonPropertyOrder({"detections", "confidence", "processing_time", "image_size", "model_used",
        "resultImagePath", "resultImageUrl", "error"})
public record SegmentationResult(
        List<Detection> detections,
        double confidence,
        @JsonProperty("processing_time") double processingTime,
        @JsonProperty("image_size") ImageSize imageSize,
        @JsonProperty("model_used") String modelUsed,
        String resultImagePath,
        @JsonInclude(JsonInclude.Include.NON_NULL) String resultImageUrl,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public static final String ERROR_MODEL = "error";
    public static final String DEGRADED_MODEL = "OpenCV_basic";

    public SegmentationResult {
        detections = List.copyOf(detections);
    }

    public static SegmentationResult failure(String error) {
        return new SegmentationResult(List.of(), 0, 0, ImageSize.EMPTY, ERROR_MODEL, "", null, error);
    }

    /** Returned instead of a failure when the native image library is missing. */
    public static SegmentationResult degraded(String reason) {
        return new SegmentationResult(List.of(), 0, 0, ImageSize.EMPTY, DEGRADED_MODEL, "", null, reason);
    }

    public SegmentationResult withResultImageUrl(String url) {
        return new SegmentationResult(detections, confidence, processingTime, imageSize, modelUsed,
                resultImagePath, url, error);
    }

    public boolean failed() {
        return ERROR_MODEL.equals(modelUsed);
    }
}
