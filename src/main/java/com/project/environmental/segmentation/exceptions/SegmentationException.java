package com.project.environmental.segmentation.exceptions;

/** Domain-specific exception for segmentation errors. */
public class SegmentationException extends RuntimeException {
    private final String code;

    public SegmentationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SegmentationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
