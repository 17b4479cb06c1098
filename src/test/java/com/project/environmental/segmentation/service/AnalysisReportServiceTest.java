package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.DTOs.BoundingBox;
import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.DTOs.DetectionAlert;
import com.project.environmental.segmentation.DTOs.DetectionLayer;
import com.project.environmental.segmentation.DTOs.DetectionSummary;
import com.project.environmental.segmentation.DTOs.GeoJsonFeature;
import com.project.environmental.segmentation.DTOs.GeoJsonFeatureCollection;
import com.project.environmental.segmentation.DTOs.ImageSize;
import com.project.environmental.segmentation.DTOs.PixelPoint;
import com.project.environmental.segmentation.DTOs.SegmentationReport;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import com.project.environmental.segmentation.service.detection.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisReportServiceTest {
    private final AnalysisReportService reports = new AnalysisReportService();

    private static Detection detection(PhenomenonClass phenomenon, double confidence, Severity severity) {
        return new Detection(phenomenon, confidence, new BoundingBox(10, 20, 30, 40), 1200, severity, Map.of());
    }

    @Test
    void environmentalRisk_followsSeverityAndClassCounts() {
        assertThat(reports.environmentalRisk(List.of())).isEqualTo(EnvironmentalRisk.LOW);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.FOREST_FIRE, 60, Severity.LOW))))
                .isEqualTo(EnvironmentalRisk.CRITICAL);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.DEFORESTATION, 60, Severity.CRITICAL),
                detection(PhenomenonClass.DEFORESTATION, 60, Severity.CRITICAL),
                detection(PhenomenonClass.DEFORESTATION, 60, Severity.CRITICAL))))
                .isEqualTo(EnvironmentalRisk.CRITICAL);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.DEFORESTATION, 60, Severity.CRITICAL))))
                .isEqualTo(EnvironmentalRisk.HIGH);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.MINING, 60, Severity.LOW),
                detection(PhenomenonClass.MINING, 60, Severity.LOW))))
                .isEqualTo(EnvironmentalRisk.HIGH);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.AGRICULTURE, 60, Severity.HIGH))))
                .isEqualTo(EnvironmentalRisk.MEDIUM);
        assertThat(reports.environmentalRisk(List.of(
                detection(PhenomenonClass.WATER_BODY, 75, Severity.LOW))))
                .isEqualTo(EnvironmentalRisk.LOW);
    }

    @Test
    void summarize_listsEveryClass() {
        DetectionSummary summary = reports.summarize(List.of(
                detection(PhenomenonClass.MINING, 60, Severity.CRITICAL),
                detection(PhenomenonClass.MINING, 60, Severity.HIGH),
                detection(PhenomenonClass.WATER_BODY, 75, Severity.LOW)));

        assertThat(summary.totalDetections()).isEqualTo(3);
        assertThat(summary.byType()).containsOnlyKeys(
                "deforestation", "mining", "forest_fire", "agriculture", "urban_expansion", "water_body");
        assertThat(summary.byType()).containsEntry("mining", 2).containsEntry("forest_fire", 0);
        assertThat(summary.criticalDetections()).isEqualTo(1);
        assertThat(summary.highRiskDetections()).isEqualTo(1);
    }

    @Test
    void layers_onlyForPresentClasses() {
        List<DetectionLayer> layers = reports.layers(List.of(
                detection(PhenomenonClass.DEFORESTATION, 60, Severity.MEDIUM),
                detection(PhenomenonClass.DEFORESTATION, 71, Severity.HIGH),
                detection(PhenomenonClass.URBAN_EXPANSION, 70, Severity.MEDIUM)));

        assertThat(layers).extracting(DetectionLayer::layerType).containsExactly("deforestation", "urban_expansion");
        DetectionLayer deforestation = layers.get(0);
        assertThat(deforestation.detectionCount()).isEqualTo(2);
        assertThat(deforestation.averageConfidence()).isEqualTo(65.5);
        assertThat(deforestation.totalArea()).isEqualTo(2400);
        assertThat(deforestation.severityDistribution())
                .containsEntry("medium", 1).containsEntry("high", 1).containsEntry("low", 0).containsEntry("critical", 0);
    }

    @Test
    void geoJson_closedPolygonPerDetection() {
        Detection fire = new Detection(PhenomenonClass.FOREST_FIRE, 70, new BoundingBox(10, 20, 30, 40), 1200,
                Severity.CRITICAL, Map.of("fire_type", "active_fire"));

        GeoJsonFeatureCollection collection = reports.geoJson(List.of(fire));

        assertThat(collection.type()).isEqualTo("FeatureCollection");
        assertThat(collection.features()).hasSize(1);
        GeoJsonFeature feature = collection.features().get(0);
        assertThat(feature.type()).isEqualTo("Feature");
        assertThat(feature.geometry().type()).isEqualTo("Polygon");
        List<int[]> ring = feature.geometry().coordinates().get(0);
        assertThat(ring).hasSize(5);
        assertThat(ring.get(0)).containsExactly(10, 20);
        assertThat(ring.get(2)).containsExactly(40, 60);
        assertThat(ring.get(4)).containsExactly(ring.get(0));
        assertThat(feature.properties())
                .containsEntry("id", "forest_fire_0")
                .containsEntry("class", "forest_fire")
                .containsEntry("severity", "critical")
                .containsEntry("fire_type", "active_fire");
    }

    @Test
    void alerts_atOrAboveThreshold() {
        Detection fire = detection(PhenomenonClass.FOREST_FIRE, 70, Severity.CRITICAL);
        Detection water = detection(PhenomenonClass.WATER_BODY, 69.99, Severity.LOW);
        Detection urban = detection(PhenomenonClass.URBAN_EXPANSION, 72.5, Severity.MEDIUM);

        List<DetectionAlert> alerts = reports.alerts(List.of(fire, water, urban), 70);

        assertThat(alerts).hasSize(2);
        DetectionAlert first = alerts.get(0);
        assertThat(first.alertType()).isEqualTo("forest_fire");
        assertThat(first.severity()).isEqualTo("critical");
        assertThat(first.title()).isEqualTo("FOREST FIRE Detected");
        assertThat(first.message()).isEqualTo("forest fire detected with 70% confidence");
        assertThat(first.coordinates()).isEqualTo(new PixelPoint(25, 40));
        assertThat(first.affectedArea()).isEqualTo(1200);
        assertThat(alerts.get(1).message()).isEqualTo("urban expansion detected with 72.5% confidence");
    }

    @Test
    void report_failedResult_isLowRiskAndEmpty() {
        SegmentationReport report = reports.report(SegmentationResult.failure("boom"), 70);

        assertThat(report.environmentalRisk()).isEqualTo("Low");
        assertThat(report.summary().totalDetections()).isZero();
        assertThat(report.layers()).isEmpty();
        assertThat(report.geoJson().features()).isEmpty();
        assertThat(report.alerts()).isEmpty();
        assertThat(report.result().imageSize()).isEqualTo(ImageSize.EMPTY);
    }
}
