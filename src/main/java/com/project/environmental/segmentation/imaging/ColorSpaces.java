package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.exceptions.InvalidInputException;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * A BGR raster together with its HSV and grayscale conversions. The conversions are
 * computed once and shared read-only by every detector of a run.
 */
public final class ColorSpaces implements AutoCloseable {
    private final Mat bgr;
    private final Mat hsv;
    private final Mat gray;

    private ColorSpaces(Mat bgr, Mat hsv, Mat gray) {
        this.bgr = bgr;
        this.hsv = hsv;
        this.gray = gray;
    }

    public static ColorSpaces of(Mat bgr) {
        if (bgr == null || bgr.empty() || bgr.cols() == 0 || bgr.rows() == 0) {
            throw new InvalidInputException("Raster is missing or has zero size");
        }
        if (bgr.channels() != 3) {
            throw new InvalidInputException("Expected a 3-channel raster, got " + bgr.channels() + " channel(s)");
        }
        Mat hsv = new Mat();
        Imgproc.cvtColor(bgr, hsv, Imgproc.COLOR_BGR2HSV);
        Mat gray = new Mat();
        Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
        return new ColorSpaces(bgr, hsv, gray);
    }

    public Mat bgr() {
        return bgr;
    }

    public Mat hsv() {
        return hsv;
    }

    public Mat gray() {
        return gray;
    }

    public int width() {
        return bgr.cols();
    }

    public int height() {
        return bgr.rows();
    }

    /** Releases the derived buffers; the source raster belongs to the caller. */
    @Override
    public void close() {
        hsv.release();
        gray.release();
    }
}
