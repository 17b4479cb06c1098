package com.project.environmental.segmentation.DTOs;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import com.project.environmental.segmentation.service.detection.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One scored, located finding. Class-specific measurements ({@code vegetation_loss},
 * {@code fire_type}, {@code edge_density}, ...) are serialized inline next to the
 * common fields.
 */
@JsonPropertyOrder({"class", "confidence", "bbox", "area", "center", "severity"})
public final class Detection {
    private final PhenomenonClass phenomenon;
    private final double confidence;
    private final BoundingBox bbox;
    private final int area;
    private final Severity severity;
    private final Map<String, Object> attributes;

    public Detection(PhenomenonClass phenomenon, double confidence, BoundingBox bbox, int area,
                     Severity severity, Map<String, Object> attributes) {
        this.phenomenon = Objects.requireNonNull(phenomenon, "phenomenon");
        this.confidence = confidence;
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.area = area;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @JsonProperty("class")
    public PhenomenonClass getPhenomenon() {
        return phenomenon;
    }

    public double getConfidence() {
        return confidence;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public int getArea() {
        return area;
    }

    public PixelPoint getCenter() {
        return bbox.center();
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Detection other)) return false;
        return Double.compare(confidence, other.confidence) == 0
                && area == other.area
                && phenomenon == other.phenomenon
                && bbox.equals(other.bbox)
                && severity == other.severity
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phenomenon, confidence, bbox, area, severity, attributes);
    }

    @Override
    public String toString() {
        return phenomenon.label() + "{confidence=" + confidence + ", bbox=" + bbox + ", area=" + area
                + ", severity=" + severity.label() + ", " + attributes + "}";
    }
}
