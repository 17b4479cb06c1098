package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.DTOs.BoundingBox;
import com.project.environmental.segmentation.DTOs.Detection;
import com.project.environmental.segmentation.DTOs.DetectionAlert;
import com.project.environmental.segmentation.DTOs.DetectionLayer;
import com.project.environmental.segmentation.DTOs.DetectionSummary;
import com.project.environmental.segmentation.DTOs.GeoJsonFeature;
import com.project.environmental.segmentation.DTOs.GeoJsonFeatureCollection;
import com.project.environmental.segmentation.DTOs.SegmentationReport;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import com.project.environmental.segmentation.service.detection.Severity;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the risk rating, per-class layers, GeoJSON and alerts from a finished detection
 * list. Pure computation, no image access.
 */
@Service
public class AnalysisReportService {

    public SegmentationReport report(SegmentationResult result, double alertThreshold) {
        List<Detection> detections = result.detections();
        return new SegmentationReport(
                result,
                environmentalRisk(detections).label(),
                summarize(detections),
                layers(detections),
                geoJson(detections),
                alerts(detections, alertThreshold));
    }

    public EnvironmentalRisk environmentalRisk(List<Detection> detections) {
        if (detections.isEmpty()) {
            return EnvironmentalRisk.LOW;
        }
        long critical = countSeverity(detections, Severity.CRITICAL);
        long high = countSeverity(detections, Severity.HIGH);
        long fires = countClass(detections, PhenomenonClass.FOREST_FIRE);
        long mining = countClass(detections, PhenomenonClass.MINING);

        if (critical > 2 || fires > 0) {
            return EnvironmentalRisk.CRITICAL;
        }
        if (critical > 0 || high > 2 || mining > 1) {
            return EnvironmentalRisk.HIGH;
        }
        if (high > 0) {
            return EnvironmentalRisk.MEDIUM;
        }
        return EnvironmentalRisk.LOW;
    }

    public DetectionSummary summarize(List<Detection> detections) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (PhenomenonClass phenomenon : PhenomenonClass.values()) {
            byType.put(phenomenon.label(), (int) countClass(detections, phenomenon));
        }
        return new DetectionSummary(
                detections.size(),
                byType,
                (int) countSeverity(detections, Severity.CRITICAL),
                (int) countSeverity(detections, Severity.HIGH));
    }

    /** One layer per class that has at least one detection. */
    public List<DetectionLayer> layers(List<Detection> detections) {
        List<DetectionLayer> layers = new ArrayList<>();
        for (PhenomenonClass phenomenon : PhenomenonClass.values()) {
            List<Detection> members = detections.stream()
                    .filter(d -> d.getPhenomenon() == phenomenon)
                    .toList();
            if (members.isEmpty()) {
                continue;
            }
            double average = members.stream().mapToDouble(Detection::getConfidence).average().orElse(0);
            long totalArea = members.stream().mapToLong(Detection::getArea).sum();

            Map<String, Integer> distribution = new LinkedHashMap<>();
            for (Severity severity : Severity.values()) {
                distribution.put(severity.label(), (int) countSeverity(members, severity));
            }
            layers.add(new DetectionLayer(phenomenon.label(), members.size(),
                    Math.round(average * 100) / 100.0, totalArea, distribution));
        }
        return layers;
    }

    public GeoJsonFeatureCollection geoJson(List<Detection> detections) {
        List<GeoJsonFeature> features = new ArrayList<>(detections.size());
        for (int i = 0; i < detections.size(); i++) {
            Detection detection = detections.get(i);
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("id", detection.getPhenomenon().label() + "_" + i);
            properties.put("class", detection.getPhenomenon().label());
            properties.put("confidence", detection.getConfidence());
            properties.put("severity", detection.getSeverity().label());
            properties.put("area", detection.getArea());
            properties.put("center", detection.getCenter().toArray());
            properties.putAll(detection.getAttributes());
            features.add(GeoJsonFeature.polygon(ring(detection.getBbox()), properties));
        }
        return GeoJsonFeatureCollection.of(features);
    }

    public List<DetectionAlert> alerts(List<Detection> detections, double threshold) {
        List<DetectionAlert> alerts = new ArrayList<>();
        for (Detection detection : detections) {
            if (detection.getConfidence() < threshold) {
                continue;
            }
            String readable = detection.getPhenomenon().label().replace('_', ' ');
            alerts.add(new DetectionAlert(
                    detection.getPhenomenon().label(),
                    detection.getSeverity().label(),
                    readable.toUpperCase(Locale.ROOT) + " Detected",
                    readable + " detected with " + plain(detection.getConfidence()) + "% confidence",
                    detection.getCenter(),
                    detection.getArea(),
                    detection.getConfidence()));
        }
        return alerts;
    }

    // Closed ring, clockwise from the top-left corner.
    private static List<int[]> ring(BoundingBox box) {
        int right = box.x() + box.width();
        int bottom = box.y() + box.height();
        return List.of(
                new int[]{box.x(), box.y()},
                new int[]{right, box.y()},
                new int[]{right, bottom},
                new int[]{box.x(), bottom},
                new int[]{box.x(), box.y()});
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static long countSeverity(List<Detection> detections, Severity severity) {
        return detections.stream().filter(d -> d.getSeverity() == severity).count();
    }

    private static long countClass(List<Detection> detections, PhenomenonClass phenomenon) {
        return detections.stream().filter(d -> d.getPhenomenon() == phenomenon).count();
    }
}
