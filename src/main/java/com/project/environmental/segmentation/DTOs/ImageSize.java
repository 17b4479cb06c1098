package com.project.environmental.segmentation.DTOs;

public record ImageSize(int width, int height) {
    public static final ImageSize EMPTY = new ImageSize(0, 0);
}
