package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.Region;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared skeleton of the per-class detectors: subclasses build their masks and score one
 * region at a time, this class applies the area gate and the aggregate confidence.
 */
public abstract class RegionDetector implements PhenomenonDetector {
    private static final Logger log = LoggerFactory.getLogger(RegionDetector.class);

    protected final MaskBuilder masks;
    protected final MorphologicalCleaner cleaner;
    protected final RegionExtractor extractor;

    protected RegionDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        this.masks = masks;
        this.cleaner = cleaner;
        this.extractor = extractor;
    }

    @Override
    public final DetectionOutcome detect(ColorSpaces image) {
        List<Detection> detections = findDetections(image);
        double confidence = phenomenon().aggregate().forCount(detections.size());
        log.debug("{}: {} detection(s), aggregate confidence {}", phenomenon().label(), detections.size(), confidence);
        return new DetectionOutcome(detections, confidence);
    }

    protected abstract List<Detection> findDetections(ColorSpaces image);

    /**
     * Extracts the regions of {@code candidates}, drops those at or below the class's
     * minimum area and scores the rest.
     */
    protected final List<Detection> scan(Mat candidates, RegionScorer scorer) {
        List<Detection> detections = new ArrayList<>();
        int gated = 0;
        int rejected = 0;
        for (Region region : extractor.extract(candidates)) {
            if (region.area() <= phenomenon().minArea()) {
                gated++;
                continue;
            }
            Optional<Detection> scored = scorer.score(region);
            if (scored.isPresent()) {
                detections.add(scored.get());
            } else {
                rejected++;
            }
        }
        if (gated > 0 || rejected > 0) {
            log.debug("{}: {} region(s) under {} px, {} below confidence floor",
                    phenomenon().label(), gated, phenomenon().minArea(), rejected);
        }
        return detections;
    }

    protected final Detection detection(Region region, double confidence, Severity severity,
                                        Map<String, Object> attributes) {
        return new Detection(phenomenon(), round(confidence, 2), region.box(), region.area(), severity, attributes);
    }

    /** Share of the region's bounding box that is set in {@code mask}. */
    protected static double ratio(Mat mask, Region region) {
        Mat roi = mask.submat(region.rect());
        int set = Core.countNonZero(roi);
        roi.release();
        return set / (double) region.box().pixelCount();
    }

    protected static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    @FunctionalInterface
    protected interface RegionScorer {
        Optional<Detection> score(Region region);
    }
}
