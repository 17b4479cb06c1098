package com.project.environmental.segmentation.exceptions;

import com.project.environmental.segmentation.service.detection.PhenomenonClass;

/** No detector pipeline is registered for a phenomenon class. */
public class UnsupportedClassException extends SegmentationException {
    public UnsupportedClassException(PhenomenonClass phenomenon) {
        super("UNSUPPORTED_CLASS", "No detector registered for class: " + phenomenon.label());
    }
}
