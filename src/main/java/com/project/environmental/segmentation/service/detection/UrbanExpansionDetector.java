package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-up areas, found by texture density (Laplacian response) instead of color.
 */
@Component
public class UrbanExpansionDetector extends RegionDetector {

    static final double TEXTURE_CUTOFF = 30;
    static final double CONFIDENCE = 70;

    public UrbanExpansionDetector(MaskBuilder masks, MorphologicalCleaner cleaner, RegionExtractor extractor) {
        super(masks, cleaner, extractor);
    }

    @Override
    public PhenomenonClass phenomenon() {
        return PhenomenonClass.URBAN_EXPANSION;
    }

    @Override
    protected List<Detection> findDetections(ColorSpaces image) {
        Mat texture = masks.texture(image.gray(), TEXTURE_CUTOFF);
        try {
            return scan(texture, region -> Optional.of(detection(region, CONFIDENCE, Severity.MEDIUM, Map.of())));
        } finally {
            texture.release();
        }
    }
}
