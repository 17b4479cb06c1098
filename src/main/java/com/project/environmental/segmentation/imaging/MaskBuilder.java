package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.exceptions.InvalidInputException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds binary masks (0 / 255, single channel) from color bands and from grayscale
 * texture. Every call returns a newly allocated mask; inputs are never modified.
 */
@Component
public class MaskBuilder {

    /** Pixels of {@code hsv} inside {@code band}. */
    public Mat band(Mat hsv, HsvBand band) {
        requireRaster(hsv);
        Mat mask = new Mat();
        Core.inRange(hsv, band.lower(), band.upper(), mask);
        return mask;
    }

    /** Pixels of {@code hsv} inside any of {@code bands}. */
    public Mat bands(Mat hsv, List<HsvBand> bands) {
        requireRaster(hsv);
        if (bands.isEmpty()) {
            return Mat.zeros(hsv.size(), CvType.CV_8UC1);
        }
        Mat combined = band(hsv, bands.get(0));
        for (int i = 1; i < bands.size(); i++) {
            Mat next = band(hsv, bands.get(i));
            Core.bitwise_or(combined, next, combined);
            next.release();
        }
        return combined;
    }

    /** Union of masks of identical size. */
    public Mat union(Mat first, Mat... others) {
        requireRaster(first);
        Mat combined = first.clone();
        for (Mat other : others) {
            Core.bitwise_or(combined, other, combined);
        }
        return combined;
    }

    /**
     * High-texture pixels: absolute discrete Laplacian of the grayscale image, saturated to
     * 8 bits, strictly above {@code cutoff}.
     */
    public Mat texture(Mat gray, double cutoff) {
        requireRaster(gray);
        Mat laplacian = new Mat();
        Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
        Mat magnitude = new Mat();
        Core.convertScaleAbs(laplacian, magnitude);
        laplacian.release();

        Mat mask = new Mat();
        Imgproc.threshold(magnitude, mask, cutoff, 255, Imgproc.THRESH_BINARY);
        magnitude.release();
        return mask;
    }

    /** Canny edge map of the grayscale image. */
    public Mat edges(Mat gray, double lowThreshold, double highThreshold) {
        requireRaster(gray);
        Mat edges = new Mat();
        Imgproc.Canny(gray, edges, lowThreshold, highThreshold);
        return edges;
    }

    private static void requireRaster(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new InvalidInputException("Raster is missing or has zero size");
        }
    }
}
