package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.HsvBand;
import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class WaterBodyDetector extends RegionDetector {

    static final HsvBand WATER = new HsvBand(100, 50, 50, 130, 255, 255);
    static final double CONFIDENCE = 75;

    public WaterBodyDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.WATER_BODY;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat water = masks.band(image.hsv(), WATER);
        try {
            return scan(water, region -> Optional.of(detection(region, CONFIDENCE, Severity.LOW, Map.of())));
        } finally {
            water.release();
        }
    }
}
