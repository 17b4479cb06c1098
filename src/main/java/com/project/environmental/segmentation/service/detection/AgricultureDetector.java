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
public class AgricultureDetector extends RegionDetector {

    static final HsvBand CROP = new HsvBand(25, 30, 30, 95, 255, 255);
    static final double CONFIDENCE = 60;

    public AgricultureDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.AGRICULTURE;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat crops = masks.band(image.hsv(), CROP);
        try {
            return scan(crops, region -> Optional.of(detection(region, CONFIDENCE, Severity.LOW, Map.of())));
        } finally {
            crops.release();
        }
    }
}
