package com.project.environmental.segmentation.controller;

import com.project.environmental.segmentation.DTOs.PhenomenonClassInfo;
import com.project.environmental.segmentation.DTOs.SegmentationReport;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import com.project.environmental.segmentation.service.AnalysisReportService;
import com.project.environmental.segmentation.service.SegmentationService;
import com.project.environmental.segmentation.service.StorageService;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/segment")
@Validated
public class SegmentationController {
    private static final Logger log = LoggerFactory.getLogger(SegmentationController.class);

    private final SegmentationService segmentationService;
    private final StorageService storageService;
    private final AnalysisReportService reportService;

    @Value("${app.alerts.default-threshold:70}")
    private int defaultAlertThreshold;

    public SegmentationController(SegmentationService segmentationService, StorageService storageService,
                                  AnalysisReportService reportService) {
        this.segmentationService = segmentationService;
        this.storageService = storageService;
        this.reportService = reportService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SegmentationResult segment(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "modelType", required = false) String modelType
    ) {
        return run(file, modelType);
    }

    @PostMapping(value = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SegmentationReport report(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "modelType", required = false) String modelType,
            @RequestParam(name = "alertThreshold", required = false)
            @Min(value = 0, message = "Alert threshold must be 0-100")
            @Max(value = 100, message = "Alert threshold must be 0-100")
            Integer alertThreshold
    ) {
        SegmentationResult result = run(file, modelType);
        int threshold = alertThreshold == null ? defaultAlertThreshold : alertThreshold;
        return reportService.report(result, threshold);
    }

    @GetMapping("/classes")
    public List<PhenomenonClassInfo> classes() {
        return Arrays.stream(PhenomenonClass.values()).map(PhenomenonClassInfo::of).toList();
    }

    private SegmentationResult run(MultipartFile file, String modelType) {
        var stored = storageService.store(file);
        log.info("Processing upload {} ({}KB) as {}", file.getOriginalFilename(), file.getSize() / 1024, stored.filename());

        try {
            SegmentationResult result = segmentationService.segment(stored.path(), modelType,
                    storageService.requestOutputDir());
            return storageService.webPathFor(result.resultImagePath())
                    .map(result::withResultImageUrl)
                    .orElse(result);
        } finally {
            storageService.delete(stored);
        }
    }
}
