package com.project.environmental.segmentation.service.detection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Ordinal risk bucket, declared from lowest to highest. */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
