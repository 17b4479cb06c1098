package com.project.environmental.segmentation.controller;

import com.project.environmental.segmentation.imaging.OpenCvRuntime;
import com.project.environmental.segmentation.service.detection.PhenomenonClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service status: whether the native library loaded and which model types are accepted.
 */
@RestController
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final OpenCvRuntime openCv;

    public HomeController(OpenCvRuntime openCv) {
        this.openCv = openCv;
    }

    @GetMapping("/")
    public Map<String, Object> index() {
        log.debug("Serving status");
        List<String> modelTypes = new ArrayList<>();
        for (PhenomenonClass phenomenon : PhenomenonClass.values()) {
            modelTypes.add(phenomenon.label());
        }
        modelTypes.add(PhenomenonClass.GENERAL);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "environmental-segmentation");
        status.put("opencvAvailable", openCv.isAvailable());
        status.put("modelTypes", modelTypes);
        return status;
    }
}
