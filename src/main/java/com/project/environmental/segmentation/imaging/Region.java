package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.DTOs.BoundingBox;
import com.project.environmental.segmentation.DTOs.PixelPoint;
import org.opencv.core.Rect;

/**
 * One connected component of a mask: bounding box and the number of pixels enclosed by its
 * outer boundary (interior holes included).
 */
public record Region(BoundingBox box, int area) {

    /** Bounding-box center, not the center of mass. */
    public PixelPoint center() {
        return box.center();
    }

    public double aspectRatio() {
        return (double) box.width() / box.height();
    }

    /** Share of the bounding box covered by the region. */
    public double extent() {
        return area / (double) box.pixelCount();
    }

    public Rect rect() {
        return new Rect(box.x(), box.y(), box.width(), box.height());
    }
}
