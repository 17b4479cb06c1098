package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.DTOs.ImageSize;
import com.project.environmental.segmentation.DTOs.SegmentationRequest;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import com.project.environmental.segmentation.exceptions.ImageLoadException;
import com.project.environmental.segmentation.exceptions.InvalidInputException;
import com.project.environmental.segmentation.exceptions.SegmentationException;
import com.project.environmental.segmentation.imaging.ColorSpaces;
import com.project.environmental.segmentation.imaging.OpenCvRuntime;
import com.project.environmental.segmentation.imaging.ResultRenderer;
import com.project.environmental.segmentation.service.detection.DetectionOutcome;
import com.project.environmental.segmentation.service.detection.DetectorDispatcher;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Runs one image through the pipeline: load, detect, render, report. Holds no state
 * between calls.
 */
@Service
public class SegmentationService {
    private static final Logger log = LoggerFactory.getLogger(SegmentationService.class);

    static final String MODEL_PREFIX = "OpenCV_Enhanced_";

    private final DetectorDispatcher dispatcher;
    private final ResultRenderer renderer;
    private final StorageService storage;
    private final OpenCvRuntime openCv;
    private final String defaultModel;
    private final boolean failOnMissingNative;

    public SegmentationService(DetectorDispatcher dispatcher, ResultRenderer renderer, StorageService storage,
                               OpenCvRuntime openCv,
                               @Value("${app.segmentation.default-model:general}") String defaultModel,
                               @Value("${app.segmentation.fail-on-missing-native:false}") boolean failOnMissingNative) {
        this.dispatcher = dispatcher;
        this.renderer = renderer;
        this.storage = storage;
        this.openCv = openCv;
        this.defaultModel = defaultModel;
        this.failOnMissingNative = failOnMissingNative;
    }

    /**
     * Same as {@link #segment(SegmentationRequest)} but never throws: any failure is
     * returned as {@link SegmentationResult#failure(String)}.
     */
    public SegmentationResult process(SegmentationRequest request) {
        try {
            return segment(request);
        } catch (SegmentationException e) {
            log.warn("Segmentation failed [{}]: {}", e.getCode(), e.getMessage());
            return SegmentationResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected segmentation failure", e);
            return SegmentationResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    public SegmentationResult segment(Path imagePath, String modelType, Path outputDir) {
        return segment(new SegmentationRequest(imagePath.toString(), outputDir.toString(), modelType));
    }

    public SegmentationResult segment(SegmentationRequest request) {
        if (request == null) {
            throw new InvalidInputException("Missing segmentation request");
        }
        Path imagePath = requirePath(request.imagePath(), "imagePath");
        Path outputDir = requirePath(request.outputDir(), "outputDir");
        String modelType = StringUtils.hasText(request.modelType()) ? request.modelType().trim() : defaultModel;

        if (!openCv.isAvailable()) {
            String reason = "Advanced dependencies not available: " + openCv.failureReason();
            if (failOnMissingNative) {
                throw new InvalidInputException(reason);
            }
            log.warn("Returning degraded result: {}", reason);
            return SegmentationResult.degraded(reason);
        }

        long start = System.nanoTime();
        Optional<PhenomenonClass> requested = PhenomenonClass.fromModelType(modelType);
        if (requested.isEmpty() && !PhenomenonClass.GENERAL.equalsIgnoreCase(modelType)) {
            log.info("Unknown model type '{}', running all detectors", modelType);
        }
        log.info("Starting segmentation of {} with model {}", imagePath, modelType);

        Mat image = load(imagePath);
        try {
            DetectionOutcome outcome;
            try (ColorSpaces spaces = ColorSpaces.of(image)) {
                outcome = dispatcher.dispatch(spaces, requested);
            }
            Path output = storage.resultImagePath(outputDir, modelType);
            renderer.render(image, outcome.detections(), output);

            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            log.info("Segmentation of {}x{} image finished: {} detection(s), confidence {}, {} s",
                    image.cols(), image.rows(), outcome.detections().size(), outcome.confidence(),
                    String.format("%.3f", seconds));
            return new SegmentationResult(
                    outcome.detections(),
                    outcome.confidence(),
                    seconds,
                    new ImageSize(image.cols(), image.rows()),
                    MODEL_PREFIX + modelType,
                    output.toString(),
                    null,
                    null);
        } finally {
            image.release();
        }
    }

    private static Mat load(Path imagePath) {
        if (!Files.isRegularFile(imagePath) || !Files.isReadable(imagePath)) {
            throw new ImageLoadException("Could not load image from " + imagePath);
        }
        Mat image = Imgcodecs.imread(imagePath.toString(), Imgcodecs.IMREAD_COLOR);
        if (image.empty()) {
            throw new ImageLoadException("Could not decode image at " + imagePath);
        }
        log.debug("Image loaded successfully: {}x{}", image.cols(), image.rows());
        return image;
    }

    private static Path requirePath(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidInputException("Missing required field: " + field);
        }
        try {
            return Paths.get(value.trim());
        } catch (InvalidPathException e) {
            throw new InvalidInputException("Invalid " + field + ": " + value, e);
        }
    }
}
