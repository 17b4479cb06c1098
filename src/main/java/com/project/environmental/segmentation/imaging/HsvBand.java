package com.project.environmental.segmentation.imaging;

import org.opencv.core.Scalar;

/**
 * Inclusive HSV range on OpenCV's 8-bit scale: hue 0-180, saturation and value 0-255.
 */
public record HsvBand(int hueLow, int satLow, int valLow, int hueHigh, int satHigh, int valHigh) {

    public HsvBand {
        if (hueLow > hueHigh || satLow > satHigh || valLow > valHigh) {
            throw new IllegalArgumentException("Inverted HSV band: " + hueLow + "," + satLow + "," + valLow
                    + " - " + hueHigh + "," + satHigh + "," + valHigh);
        }
    }

    public Scalar lower() {
        return new Scalar(hueLow, satLow, valLow);
    }

    public Scalar upper() {
        return new Scalar(hueHigh, satHigh, valHigh);
    }
}
