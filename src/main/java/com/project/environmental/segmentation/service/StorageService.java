package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.exceptions.InvalidInputException;
import com.project.environmental.segmentation.exceptions.OutputWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * File-system side of the service: stored uploads, result image naming and the
 * directory served under {@code /results/}.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    private static final DateTimeFormatter UPLOAD_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final DateTimeFormatter RESULT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path uploadDir;
    private final Path outputDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String uploadDir,
                          @Value("${app.output.dir:results}") String outputDir) {
        this.uploadDir = Paths.get(uploadDir).toAbsolutePath().normalize();
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
    }

    public record StoredFile(Path path, String filename) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new InvalidInputException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String filename = UPLOAD_STAMP.format(LocalDateTime.now()) + "_" + safeName(original);
        Path target = ensureDirectory(uploadDir).resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Upload stored as {}", target);
            return new StoredFile(target, filename);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to store upload", e);
        }
    }

    /** Directory for results of HTTP requests, created on first use. */
    public Path outputDir() {
        return ensureDirectory(outputDir);
    }

    /**
     * Fresh subdirectory of {@link #outputDir()} for one request, so concurrent requests
     * never write to the same result file.
     */
    public Path requestOutputDir() {
        return ensureDirectory(outputDir.resolve(UUID.randomUUID().toString()));
    }

    /** Removes a stored upload once it has been processed. */
    public void delete(StoredFile stored) {
        try {
            if (Files.deleteIfExists(stored.path())) {
                log.debug("Upload {} removed", stored.filename());
            }
        } catch (IOException e) {
            log.warn("Could not remove upload {}: {}", stored.path(), e.getMessage());
        }
    }

    /** {@code segmentation_result_<modelType>_<yyyyMMdd_HHmmss>.jpg} inside {@code directory}. */
    public Path resultImagePath(Path directory, String modelType) {
        String stamp = RESULT_STAMP.format(LocalDateTime.now());
        return directory.resolve("segmentation_result_" + safeName(modelType) + "_" + stamp + ".jpg");
    }

    /** URL path of a result image, when it lives in the served output directory. */
    public Optional<String> webPathFor(String resultImagePath) {
        if (!StringUtils.hasText(resultImagePath)) {
            return Optional.empty();
        }
        Path image = Paths.get(resultImagePath).toAbsolutePath().normalize();
        if (!image.startsWith(outputDir) || image.equals(outputDir)) {
            return Optional.empty();
        }
        StringJoiner url = new StringJoiner("/", "/results/", "");
        for (Path part : outputDir.relativize(image)) {
            url.add(part.toString());
        }
        return Optional.of(url.toString());
    }

    private static String safeName(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static Path ensureDirectory(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new OutputWriteException("Cannot create directory: " + directory, e);
        }
    }
}
