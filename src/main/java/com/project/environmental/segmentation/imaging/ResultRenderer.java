package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.DTOs.BoundingBox;
import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.exceptions.OutputWriteException;
import com.project.environmental.segmentation.service.detection.Severity;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Draws color-coded boxes and labels for every detection onto a copy of the source
 * raster and writes the result to disk.
 */
@Component
public class ResultRenderer {
    private static final Logger log = LoggerFactory.getLogger(ResultRenderer.class);

    private static final double LABEL_SCALE = 0.6;
    private static final int LABEL_THICKNESS = 2;
    private static final int LABEL_OFFSET = 10;

    public Path render(Mat original, List<Detection> detections, Path output) {
        Path directory = output.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            throw new OutputWriteException("Output directory does not exist: " + directory);
        }

        Mat annotated = annotate(original, detections);
        try {
            if (!Imgcodecs.imwrite(output.toString(), annotated)) {
                throw new OutputWriteException("Could not write result image to " + output);
            }
        } catch (CvException e) {
            throw new OutputWriteException("Could not write result image to " + output + ": " + e.getMessage(), e);
        } finally {
            annotated.release();
        }
        log.debug("Result image with {} detection(s) written to {}", detections.size(), output);
        return output;
    }

    /** Annotated copy of {@code original}; the source raster is left untouched. */
    public Mat annotate(Mat original, List<Detection> detections) {
        Mat canvas = original.clone();
        for (Detection detection : detections) {
            BoundingBox box = detection.getBbox();
            int[] rgb = detection.getPhenomenon().rgb();
            Scalar color = new Scalar(rgb[2], rgb[1], rgb[0]);

            Imgproc.rectangle(canvas,
                    new Point(box.x(), box.y()),
                    new Point(box.x() + box.width(), box.y() + box.height()),
                    color, thicknessFor(detection.getSeverity()));

            Imgproc.putText(canvas, label(detection),
                    new Point(box.x(), box.y() - LABEL_OFFSET),
                    Imgproc.FONT_HERSHEY_SIMPLEX, LABEL_SCALE, color, LABEL_THICKNESS);
        }
        return canvas;
    }

    static int thicknessFor(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 4;
            case HIGH -> 3;
            default -> 2;
        };
    }

    static String label(Detection detection) {
        return String.format(Locale.ROOT, "%s: %.1f%%", detection.getPhenomenon().label(), detection.getConfidence());
    }
}
