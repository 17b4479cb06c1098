package com.project.environmental.segmentation.DTOs;

import com.project.environmental.segmentation.service.detection.AggregateConfidence;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;

/** Read-only view of one phenomenon's constant table. */
public record PhenomenonClassInfo(String name, int minArea, AggregateConfidence aggregate, int[] color) {

    public static PhenomenonClassInfo of(PhenomenonClass phenomenon) {
        return new PhenomenonClassInfo(phenomenon.label(), phenomenon.minArea(), phenomenon.aggregate(), phenomenon.rgb());
    }
}
