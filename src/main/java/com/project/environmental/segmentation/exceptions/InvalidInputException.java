package com.project.environmental.segmentation.exceptions;

/** Missing or zero-sized raster, malformed request arguments. */
public class InvalidInputException extends SegmentationException {
    public InvalidInputException(String message) { super("INVALID_INPUT", message); }
    public InvalidInputException(String message, Throwable cause) { super("INVALID_INPUT", message, cause); }
}
