package com.project.environmental.segmentation.DTOs;

import java.util.List;

public record GeoJsonFeatureCollection(String type, List<GeoJsonFeature> features) {

    public static GeoJsonFeatureCollection of(List<GeoJsonFeature> features) {
        return new GeoJsonFeatureCollection("FeatureCollection", List.copyOf(features));
    }
}
