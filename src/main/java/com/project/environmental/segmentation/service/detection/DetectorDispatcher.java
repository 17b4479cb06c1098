package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.exceptions.UnsupportedClassException;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a request to one phenomenon detector, or runs all of them in declaration order
 * and merges their detections when no single class was requested.
 */
@Service
public class DetectorDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DetectorDispatcher.class);

    private final Map<PhenomenonClass, PhenomenonDetector> detectors;

    public DetectorDispatcher(List<PhenomenonDetector> detectors) {
        Map<PhenomenonClass, PhenomenonDetector> byClass = new EnumMap<>(PhenomenonClass.class);
        for (PhenomenonDetector detector : detectors) {
            PhenomenonDetector previous = byClass.put(detector.phenomenon(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.phenomenon().label()
                        + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
            }
        }
        this.detectors = Collections.unmodifiableMap(byClass);
        log.debug("Registered detectors: {}", this.detectors.keySet());
    }

    /**
     * @param requested single class to run, or empty for every class
     */
    public DetectionOutcome dispatch(ColorSpaces image, Optional<PhenomenonClass> requested) {
        if (requested.isPresent()) {
            return detectorFor(requested.get()).detect(image);
        }
        return detectAll(image);
    }

    public DetectionOutcome detectAll(ColorSpaces image) {
        List<Detection> all = new ArrayList<>();
        for (PhenomenonClass phenomenon : PhenomenonClass.values()) {
            all.addAll(detectorFor(phenomenon).detect(image).detections());
        }
        return new DetectionOutcome(all, AggregateConfidence.GENERAL.forCount(all.size()));
    }

    public PhenomenonDetector detectorFor(PhenomenonClass phenomenon) {
        PhenomenonDetector detector = detectors.get(phenomenon);
        if (detector == null) {
            throw new UnsupportedClassException(phenomenon);
        }
        return detector;
    }
}
