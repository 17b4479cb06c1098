package com.project.environmental.segmentation.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EnvironmentalRisk {
    LOW("Low"), MEDIUM("Medium"), HIGH("High"), CRITICAL("Critical");

    private final String label;

    EnvironmentalRisk(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
