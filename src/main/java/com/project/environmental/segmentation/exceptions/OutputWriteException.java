package com.project.environmental.segmentation.exceptions;

/** Annotated result image (or an upload) could not be written. */
public class OutputWriteException extends SegmentationException {
    public OutputWriteException(String message) { super("OUTPUT_WRITE", message); }
    public OutputWriteException(String message, Throwable cause) { super("OUTPUT_WRITE", message, cause); }
}
