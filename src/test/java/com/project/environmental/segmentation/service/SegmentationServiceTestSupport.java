package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.OpenCvRuntime;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import com.project.environmental.segmentation.imaging.ResultRenderer;
import com.project.environmental.segmentation.service.detection.AgricultureDetector;
import com.project.environmental.segmentation.service.detection.DeforestationDetector;
import com.project.environmental.segmentation.service.detection.DetectorDispatcher;
import com.project.environmental.segmentation.service.detection.ForestFireDetector;
import com.project.environmental.segmentation.service.detection.MiningDetector;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import com.project.environmental.segmentation.service.detection.UrbanExpansionDetector;
import com.project.environmental.segmentation.service.detection.WaterBodyDetector;

import java.nio.file.Path;
import java.util.List;

/** Wires a {@link SegmentationService} by hand, without a Spring context. */
public final class SegmentationServiceTestSupport {

    private SegmentationServiceTestSupport() {}

    public static SegmentationService service(Path workDir, OpenCvRuntime openCv, boolean failOnMissingNative) {
        MaskBuilder masks = new MaskBuilder();
        MorphologicalCleaner cleaner = new MorphologicalCleaner();
        RegionExtractor extractor = new RegionExtractor();
        DetectorDispatcher dispatcher = new DetectorDispatcher(List.of(
                new DeforestationDetector(masks, cleaner, extractor),
                new MiningDetector(masks, cleaner, extractor),
                new ForestFireDetector(masks, cleaner, extractor),
                new AgricultureDetector(masks, cleaner, extractor),
                new UrbanExpansionDetector(masks, cleaner, extractor),
                new WaterBodyDetector(masks, cleaner, extractor)));
        StorageService storage = new StorageService(
                workDir.resolve("uploads").toString(), workDir.resolve("results").toString());
        return new SegmentationService(dispatcher, new ResultRenderer(), storage, openCv,
                PhenomenonClass.GENERAL, failOnMissingNative);
    }

    public static SegmentationService service(Path workDir) {
        return service(workDir, new OpenCvRuntime(), false);
    }

    /** Runtime whose native library failed to load. */
    public static OpenCvRuntime missingNative() {
        return new OpenCvRuntime() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public String failureReason() {
                return "UnsatisfiedLinkError: no opencv_java";
            }
        };
    }
}
