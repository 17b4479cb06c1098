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
 * Cleared land: bare soil and cleared ground scored against how much vegetation is left
 * inside the region's bounding box.
 */
@Component
public class DeforestationDetector extends RegionDetector {

    static final List<HsvBand> VEGETATION = List.of(
            new HsvBand(35, 40, 40, 85, 255, 255),
            new HsvBand(25, 30, 30, 45, 255, 255));
    static final List<HsvBand> CLEARED = List.of(
            new HsvBand(8, 50, 20, 25, 255, 200),
            new HsvBand(15, 30, 100, 30, 150, 255));

    static final int KERNEL_SIZE = 5;
    static final double MIN_CONFIDENCE = 30;
    static final double MAX_CONFIDENCE = 95;
    static final double CONFIDENCE_FLOOR = 35;

    public DeforestationDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.DEFORESTATION;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat vegetation = masks.bands(image.hsv(), VEGETATION);
        Mat cleared = masks.bands(image.hsv(), CLEARED);
        Mat cleaned = cleaner.closeThenOpen(cleared, KERNEL_SIZE);
        try {
            return scan(cleaned, region -> score(region, cleaned, vegetation));
        } finally {
            vegetation.release();
            cleared.release();
            cleaned.release();
        }
    }

    private Optional<Detection> score(Region region, Mat cleared, Mat vegetation) {
        double coverage = ratio(cleared, region) * 100;
        double vegetationLoss = 100 - ratio(vegetation, region) * 100;
        double confidence = confidence(coverage, vegetationLoss);
        if (confidence <= CONFIDENCE_FLOOR) {
            return Optional.empty();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("vegetation_loss", round(vegetationLoss, 2));
        attributes.put("coverage", round(coverage, 2));
        return Optional.of(detection(region, confidence, severity(region.area(), vegetationLoss), attributes));
    }

    /** Both inputs are percentages of the bounding box. */
    static double confidence(double coverage, double vegetationLoss) {
        double raw = coverage * 0.4 + vegetationLoss * 0.4 + 20;
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, raw));
    }

    static Severity severity(int area, double vegetationLoss) {
        if (area > 10000 && vegetationLoss > 70) {
            return Severity.CRITICAL;
        }
        if (area > 5000 && vegetationLoss > 50) {
            return Severity.HIGH;
        }
        if (vegetationLoss > 30) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
