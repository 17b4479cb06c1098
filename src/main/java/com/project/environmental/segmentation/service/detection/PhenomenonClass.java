package com.project.environmental.segmentation.service.detection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The six detectable phenomena with their constant tables: minimum region area,
 * aggregate confidence parameters and the RGB color used for rendering.
 */
public enum PhenomenonClass {
    DEFORESTATION("deforestation", null, 1000, new AggregateConfidence(15, 45, 90, 25), 255, 0, 0),
    MINING("mining", null, 2000, new AggregateConfidence(20, 40, 85, 30), 255, 165, 0),
    FOREST_FIRE("forest_fire", null, 500, new AggregateConfidence(25, 35, 90, 20), 255, 69, 0),
    AGRICULTURE("agriculture", null, 1500, new AggregateConfidence(12, 30, 75, 20), 0, 255, 0),
    URBAN_EXPANSION("urban_expansion", "urban", 2500, new AggregateConfidence(18, 25, 70, 15), 128, 128, 128),
    WATER_BODY("water_body", "water", 1000, new AggregateConfidence(25, 30, 80, 20), 0, 0, 255);

    public static final String GENERAL = "general";

    private final String label;
    private final String alias;
    private final int minArea;
    private final AggregateConfidence aggregate;
    private final int red;
    private final int green;
    private final int blue;

    PhenomenonClass(String label, String alias, int minArea, AggregateConfidence aggregate,
                    int red, int green, int blue) {
        this.label = label;
        this.alias = alias;
        this.minArea = minArea;
        this.aggregate = aggregate;
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Regions must be strictly larger than this many pixels to be scored. */
    public int minArea() {
        return minArea;
    }

    public AggregateConfidence aggregate() {
        return aggregate;
    }

    public int[] rgb() {
        return new int[]{red, green, blue};
    }

    /**
     * Resolves a requested model type. {@code general}, blank and unknown names resolve to
     * empty, meaning "run every detector".
     */
    public static Optional<PhenomenonClass> fromModelType(String modelType) {
        if (modelType == null || modelType.isBlank()) {
            return Optional.empty();
        }
        String key = modelType.trim().toLowerCase(Locale.ROOT);
        for (PhenomenonClass phenomenon : values()) {
            if (phenomenon.label.equals(key) || key.equals(phenomenon.alias)) {
                return Optional.of(phenomenon);
            }
        }
        return Optional.empty();
    }
}
