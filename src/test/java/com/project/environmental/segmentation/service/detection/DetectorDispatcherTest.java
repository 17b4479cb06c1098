package com.project.environmental.segmentation.service.detection;

import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.TestRasters;
import com.project.environmental.segmentation.exceptions.UnsupportedClassException;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.MaskBuilder;
import com.project.environmental.segmentation.imaging.MorphologicalCleaner;
import com.project.environmental.segmentation.imaging.RegionExtractor;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorDispatcherTest {
    private static final MaskBuilder MASKS = new MaskBuilder();
    private static final MorphologicalCleaner CLEANER = new MorphologicalCleaner();
    private static final RegionExtractor EXTRACTOR = new RegionExtractor();

    @BeforeAll
    static void loadOpenCv() {
        TestRasters.requireOpenCv();
    }

    private static List<PhenomenonDetector> allDetectors() {
        return List.of(
                new WaterBodyDetector(MASKS, CLEANER, EXTRACTOR),
                new DeforestationDetector(MASKS, CLEANER, EXTRACTOR),
                new MiningDetector(MASKS, CLEANER, EXTRACTOR),
                new ForestFireDetector(MASKS, CLEANER, EXTRACTOR),
                new AgricultureDetector(MASKS, CLEANER, EXTRACTOR),
                new UrbanExpansionDetector(MASKS, CLEANER, EXTRACTOR));
    }

    private static Mat landscape() {
        Mat image = TestRasters.filled(300, 240, TestRasters.FOREST);
        TestRasters.fill(image, 10, 10, 60, 50, TestRasters.SOIL);
        TestRasters.fill(image, 150, 20, 80, 60, TestRasters.WATER);
        TestRasters.fill(image, 40, 150, 50, 50, TestRasters.FIRE);
        return image;
    }

    @Test
    void general_isConcatenationOfPerClassRunsInClassOrder() {
        DetectorDispatcher dispatcher = new DetectorDispatcher(allDetectors());
        try (ColorSpaces spaces = ColorSpaces.of(landscape())) {
            List<Detection> expected = new ArrayList<>();
            for (PhenomenonClass phenomenon : PhenomenonClass.values()) {
                expected.addAll(dispatcher.dispatch(spaces, Optional.of(phenomenon)).detections());
            }

            DetectionOutcome general = dispatcher.dispatch(spaces, Optional.empty());

            assertThat(expected).isNotEmpty();
            assertThat(general.detections()).containsExactlyElementsOf(expected);
            assertThat(general.confidence())
                    .isEqualTo(AggregateConfidence.GENERAL.forCount(expected.size()));
        }
    }

    @Test
    void general_tinyImage_hasNoDetectionsAndEmptyConfidence() {
        DetectorDispatcher dispatcher = new DetectorDispatcher(allDetectors());
        try (ColorSpaces spaces = ColorSpaces.of(TestRasters.filled(20, 20, TestRasters.BLACK))) {
            DetectionOutcome outcome = dispatcher.dispatch(spaces, Optional.empty());

            assertThat(outcome.detections()).isEmpty();
            assertThat(outcome.confidence()).isEqualTo(35.0);
        }
    }

    @Test
    void singleClass_noRegions_usesClassEmptyConfidence() {
        DetectorDispatcher dispatcher = new DetectorDispatcher(allDetectors());
        try (ColorSpaces spaces = ColorSpaces.of(TestRasters.filled(20, 20, TestRasters.BLACK))) {
            assertThat(dispatcher.dispatch(spaces, Optional.of(PhenomenonClass.DEFORESTATION)).confidence())
                    .isEqualTo(25.0);
            assertThat(dispatcher.dispatch(spaces, Optional.of(PhenomenonClass.URBAN_EXPANSION)).confidence())
                    .isEqualTo(15.0);
        }
    }

    @Test
    void missingDetector_isUnsupportedClass() {
        DetectorDispatcher dispatcher = new DetectorDispatcher(
                List.of(new WaterBodyDetector(MASKS, CLEANER, EXTRACTOR)));

        assertThatThrownBy(() -> dispatcher.detectorFor(PhenomenonClass.MINING))
                .isInstanceOf(UnsupportedClassException.class)
                .hasMessageContaining("mining");
    }

    @Test
    void duplicateRegistration_isRejected() {
        List<PhenomenonDetector> detectors = List.of(
                new WaterBodyDetector(MASKS, CLEANER, EXTRACTOR),
                new WaterBodyDetector(MASKS, CLEANER, EXTRACTOR));

        assertThatThrownBy(() -> new DetectorDispatcher(detectors))
                .isInstanceOf(IllegalStateException.class);
    }
}
