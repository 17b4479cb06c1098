package com.project.environmental.segmentation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.environmental.segmentation.DTOs.SegmentationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.PrintStream;

/**
 * Entry point. With a program argument the application runs once as a command-line tool
 * (JSON request in, JSON result on stdout); without arguments it starts the HTTP API.
 */
@SpringBootApplication
public class Application {
    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Application.class);
        if (args.length > 0) {
            System.exit(runCommandLine(app, args, System.out));
        }
        app.run(args);
    }

    /**
     * Runs {@code app} once without a web server. A context that fails to start still
     * produces the failure JSON on {@code out} and exit code 1.
     */
    static int runCommandLine(SpringApplication app, String[] args, PrintStream out) {
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setBannerMode(Banner.Mode.OFF);
        try {
            return SpringApplication.exit(app.run(args));
        } catch (RuntimeException e) {
            log.error("Application failed to start", e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            try {
                out.println(new ObjectMapper().writeValueAsString(SegmentationResult.failure(message)));
            } catch (JsonProcessingException serialization) {
                log.error("Could not serialize failure result", serialization);
            }
            out.flush();
            return 1;
        }
    }
}
