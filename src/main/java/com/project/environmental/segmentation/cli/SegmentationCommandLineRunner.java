package com.project.environmental.segmentation.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.environmental.segmentation.DTOs.SegmentationRequest;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import com.project.environmental.segmentation.exceptions.InvalidInputException;
import com.project.environmental.segmentation.service.SegmentationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnNotWebApplication;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line contract: the first argument is a JSON request, or {@code @file} naming a
 * file holding one. The result JSON is the only thing written to stdout; the exit code is
 * 1 when the run failed.
 */
@Component
@ConditionalOnNotWebApplication
public class SegmentationCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(SegmentationCommandLineRunner.class);

    private final SegmentationService segmentationService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public SegmentationCommandLineRunner(SegmentationService segmentationService, ObjectMapper objectMapper) {
        this(segmentationService, objectMapper, System.out);
    }

    SegmentationCommandLineRunner(SegmentationService segmentationService, ObjectMapper objectMapper, PrintStream out) {
        this.segmentationService = segmentationService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws JsonProcessingException {
        SegmentationResult result;
        try {
            result = segmentationService.process(parseRequest(args));
        } catch (InvalidInputException e) {
            log.warn("Rejected command-line request: {}", e.getMessage());
            result = SegmentationResult.failure(e.getMessage());
        }
        exitCode = result.failed() ? 1 : 0;
        out.println(objectMapper.writeValueAsString(result));
        out.flush();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    SegmentationRequest parseRequest(String... args) {
        if (args.length == 0 || args[0].isBlank()) {
            throw new InvalidInputException("Missing JSON request argument");
        }
        String json = args[0].startsWith("@") ? readFile(args[0].substring(1)) : args[0];
        try {
            SegmentationRequest request = objectMapper.readValue(json, SegmentationRequest.class);
            if (request == null) {
                throw new InvalidInputException("Empty JSON request");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed JSON request: " + e.getOriginalMessage(), e);
        }
    }

    private static String readFile(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            throw new InvalidInputException("Cannot read request file " + path + ": " + e.getMessage(), e);
        }
    }
}
