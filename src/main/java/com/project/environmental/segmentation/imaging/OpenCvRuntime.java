package com.project.environmental.segmentation.imaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the bundled OpenCV native library once per JVM and remembers whether that worked.
 */
@Component
public class OpenCvRuntime {
    private static final Logger log = LoggerFactory.getLogger(OpenCvRuntime.class);

    private static Boolean loaded;
    private static String failureReason;

    /** @return true when the native library is usable in this JVM */
    public static synchronized boolean ensureLoaded() {
        if (loaded == null) {
            try {
                nu.pattern.OpenCV.loadLocally();
                loaded = Boolean.TRUE;
                log.info("OpenCV {} loaded successfully", org.opencv.core.Core.VERSION);
            } catch (RuntimeException | LinkageError e) {
                loaded = Boolean.FALSE;
                failureReason = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("Failed to load OpenCV", e);
            }
        }
        return loaded;
    }

    public boolean isAvailable() {
        return ensureLoaded();
    }

    public String failureReason() {
        ensureLoaded();
        return failureReason == null ? "" : failureReason;
    }
}
