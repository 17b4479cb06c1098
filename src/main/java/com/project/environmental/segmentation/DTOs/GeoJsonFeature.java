package com.project.environmental.segmentation.DTOs;

import java.util.List;
import java.util.Map;

/** GeoJSON feature with a polygon in pixel coordinates. */
public record GeoJsonFeature(String type, Geometry geometry, Map<String, Object> properties) {

    public record Geometry(String type, List<List<int[]>> coordinates) {}

    public static GeoJsonFeature polygon(List<int[]> ring, Map<String, Object> properties) {
        return new GeoJsonFeature("Feature", new Geometry("Polygon", List.of(ring)), properties);
    }
}
