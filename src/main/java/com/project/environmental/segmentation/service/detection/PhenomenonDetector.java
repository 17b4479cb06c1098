package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.imaging.ColorSpaces;

/** One per-class pipeline: masks, cleanup, region extraction and scoring. */
public interface PhenomenonDetector {

    PhenomenonClass phenomenon();

    DetectionOutcome detect(ColorSpaces image);
}
