package com.project.environmental.segmentation.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

/** Axis-aligned box in pixel coordinates, serialized as {@code [x, y, width, height]}. */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative box size: " + width + "x" + height);
        }
    }

    /** Box center, truncated to whole pixels. */
    public PixelPoint center() {
        return new PixelPoint(x + width / 2, y + height / 2);
    }

    public long pixelCount() {
        return (long) width * height;
    }

    @JsonValue
    public int[] toArray() {
        return new int[]{x, y, width, height};
    }
}
