package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.HsvBand;
import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.Region;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exposed rock, metallic surfaces and disturbed earth, scored on shape regularity and on
 * the density of Canny edges inside the region.
 */
@Component
public class MiningDetector extends RegionDetector {

    static final HsvBand ROCK = new HsvBand(0, 0, 80, 30, 80, 255);
    static final HsvBand METAL = new HsvBand(0, 0, 150, 180, 50, 255);
    static final HsvBand DISTURBED_EARTH = new HsvBand(5, 100, 50, 20, 255, 200);

    static final int KERNEL_SIZE = 7;
    static final double CANNY_LOW = 50;
    static final double CANNY_HIGH = 150;
    static final double MAX_CONFIDENCE = 95;
    static final double CONFIDENCE_FLOOR = 60;
    static final double INFRASTRUCTURE_RATIO = 0.1;

    public MiningDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.MINING;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat rock = masks.band(image.hsv(), ROCK);
        Mat metal = masks.band(image.hsv(), METAL);
        Mat disturbed = masks.band(image.hsv(), DISTURBED_EARTH);
        Mat combined = masks.union(rock, metal, disturbed);
        Mat cleaned = cleaner.close(combined, KERNEL_SIZE);
        Mat edges = masks.edges(image.gray(), CANNY_LOW, CANNY_HIGH);
        try {
            return scan(cleaned, region -> score(region, edges, rock, metal, disturbed));
        } finally {
            for (Mat mat : List.of(rock, metal, disturbed, combined, cleaned, edges)) {
                mat.release();
            }
        }
    }

    private Optional<Detection> score(Region region, Mat edges, Mat rock, Mat metal, Mat disturbed) {
        double aspectRatio = region.aspectRatio();
        double edgeDensity = ratio(edges, region);
        double confidence = confidence(aspectRatio, region.extent(), edgeDensity);
        if (confidence <= CONFIDENCE_FLOOR) {
            return Optional.empty();
        }
        double rockRatio = ratio(rock, region);
        double metalRatio = ratio(metal, region);
        double disturbedRatio = ratio(disturbed, region);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("aspect_ratio", round(aspectRatio, 2));
        attributes.put("edge_density", round(edgeDensity, 3));
        attributes.put("mining_type", miningType(rockRatio, metalRatio, disturbedRatio));
        attributes.put("infrastructure_detected", metalRatio > INFRASTRUCTURE_RATIO);
        return Optional.of(detection(region, confidence, severity(region.area(), edgeDensity), attributes));
    }

    static double confidence(double aspectRatio, double extent, double edgeDensity) {
        double confidence = 50;
        if (aspectRatio > 0.3 && aspectRatio < 3.0) {
            confidence += 15;
        }
        if (extent > 0.5) {
            confidence += 10;
        }
        if (edgeDensity > 0.1) {
            confidence += 15;
        }
        return Math.min(MAX_CONFIDENCE, confidence);
    }

    static Severity severity(int area, double edgeDensity) {
        if (area > 50000 && edgeDensity > 0.15) {
            return Severity.CRITICAL;
        }
        if (area > 20000) {
            return Severity.HIGH;
        }
        if (area > 10000) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /** Names the band that covers most of the box; rock wins ties. */
    static String miningType(double rockRatio, double metalRatio, double disturbedRatio) {
        if (disturbedRatio > rockRatio && disturbedRatio >= metalRatio) {
            return "open_pit";
        }
        if (metalRatio > rockRatio) {
            return "infrastructure";
        }
        return "quarry";
    }
}
