package com.project.environmental.segmentation.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

/** Pixel position, serialized as {@code [x, y]}. */
public record PixelPoint(int x, int y) {

    @JsonValue
    public int[] toArray() {
        return new int[]{x, y};
    }
}
