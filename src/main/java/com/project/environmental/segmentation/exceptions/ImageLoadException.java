package com.project.environmental.segmentation.exceptions;

/** Image path unreadable or not decodable. */
public class ImageLoadException extends SegmentationException {
    public ImageLoadException(String message) { super("IMAGE_LOAD", message); }
    public ImageLoadException(String message, Throwable cause) { super("IMAGE_LOAD", message, cause); }
}
