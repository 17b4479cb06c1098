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
 * Active fire and flame hues, smoke and burned ground. The strongest indicator present in
 * a region decides its fire type; severity weighs all three.
 */
@Component
public class ForestFireDetector extends RegionDetector {

    static final List<HsvBand> ACTIVE_FIRE = List.of(
            new HsvBand(0, 100, 100, 10, 255, 255),
            new HsvBand(170, 100, 100, 180, 255, 255),
            new HsvBand(15, 150, 150, 35, 255, 255));
    static final HsvBand SMOKE = new HsvBand(0, 0, 100, 180, 30, 200);
    static final HsvBand BURNED = new HsvBand(0, 0, 0, 180, 255, 80);

    static final double MAX_CONFIDENCE = 95;
    static final double CONFIDENCE_FLOOR = 50;

    public ForestFireDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.FOREST_FIRE;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat active = masks.bands(image.hsv(), ACTIVE_FIRE);
        Mat smoke = masks.band(image.hsv(), SMOKE);
        Mat burned = masks.band(image.hsv(), BURNED);
        Mat indicators = masks.union(active, smoke, burned);
        try {
            return scan(indicators, region -> score(region, active, smoke, burned));
        } finally {
            for (Mat mat : List.of(active, smoke, burned, indicators)) {
                mat.release();
            }
        }
    }

    private Optional<Detection> score(Region region, Mat active, Mat smoke, Mat burned) {
        double activeRatio = ratio(active, region);
        double smokeRatio = ratio(smoke, region);
        double burnedRatio = ratio(burned, region);

        FireType fireType = FireType.classify(activeRatio, smokeRatio, burnedRatio);
        double confidence = Math.min(MAX_CONFIDENCE, 40 + fireType.bonus);
        if (confidence <= CONFIDENCE_FLOOR) {
            return Optional.empty();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("fire_type", fireType.label);
        attributes.put("active_fire_ratio", round(activeRatio, 3));
        attributes.put("smoke_ratio", round(smokeRatio, 3));
        attributes.put("burned_ratio", round(burnedRatio, 3));
        Severity severity = severity(region.area(), activeRatio, smokeRatio, burnedRatio);
        return Optional.of(detection(region, confidence, severity, attributes));
    }

    static Severity severity(int area, double activeRatio, double smokeRatio, double burnedRatio) {
        double indicators = activeRatio + smokeRatio + burnedRatio * 0.5;
        if (indicators > 0.7 || area > 20000) {
            return Severity.CRITICAL;
        }
        if (indicators > 0.4 || area > 10000) {
            return Severity.HIGH;
        }
        if (indicators > 0.2) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    enum FireType {
        ACTIVE_FIRE("active_fire", 30),
        SMOKE("smoke", 25),
        BURNED_AREA("burned_area", 20),
        FIRE_RISK("fire_risk", 0);

        final String label;
        final int bonus;

        FireType(String label, int bonus) {
            this.label = label;
            this.bonus = bonus;
        }

        static FireType classify(double activeRatio, double smokeRatio, double burnedRatio) {
            if (activeRatio > 0.1) {
                return ACTIVE_FIRE;
            }
            if (smokeRatio > 0.3) {
                return SMOKE;
            }
            if (burnedRatio > 0.5) {
                return BURNED_AREA;
            }
            return FIRE_RISK;
        }
    }
}
