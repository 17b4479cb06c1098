package com.project.environmental.segmentation.imaging;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * Closing bridges small gaps inside a detection, opening removes isolated speckles.
 * Both use a square structuring element and return a new mask.
 */
@Component
public class MorphologicalCleaner {

    public Mat close(Mat mask, int kernelSize) {
        return apply(mask, Imgproc.MORPH_CLOSE, kernelSize);
    }

    public Mat open(Mat mask, int kernelSize) {
        return apply(mask, Imgproc.MORPH_OPEN, kernelSize);
    }

    /** Closing followed by opening with the same kernel. */
    public Mat closeThenOpen(Mat mask, int kernelSize) {
        Mat closed = close(mask, kernelSize);
        Mat opened = open(closed, kernelSize);
        closed.release();
        return opened;
    }

    private static Mat apply(Mat mask, int operation, int kernelSize) {
        if (kernelSize < 1) {
            throw new IllegalArgumentException("Kernel size must be positive: " + kernelSize);
        }
        if (mask.empty()) {
            return mask.clone();
        }
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(kernelSize, kernelSize));
        Mat out = new Mat();
        Imgproc.morphologyEx(mask, out, operation, kernel);
        kernel.release();
        return out;
    }
}
