package com.project.environmental.segmentation.service;

import com.project.environmental.segmentation.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {

    @TempDir
    Path tmp;

    private StorageService storage() {
        return new StorageService(tmp.resolve("uploads").toString(), tmp.resolve("results").toString());
    }

    @Test
    void store_writesUploadUnderTimestampedName() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "my scene.png", "image/png", new byte[]{1, 2, 3, 4});

        var stored = storage().store(file);

        assertThat(stored.path()).exists();
        assertThat(stored.path().getParent()).isEqualTo(tmp.resolve("uploads").toAbsolutePath().normalize());
        assertThat(stored.filename()).matches("\\d{8}_\\d{6}_\\d{3}_my_scene\\.png");
        assertThat(Files.readAllBytes(stored.path())).containsExactly(1, 2, 3, 4);
    }

    @Test
    void store_rejectsNonImage() {
        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());

        assertThatThrownBy(() -> storage().store(notImage)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void store_rejectsEmptyUpload() {
        MockMultipartFile empty = new MockMultipartFile("file", "x.png", "image/png", new byte[0]);

        assertThatThrownBy(() -> storage().store(empty)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void resultImagePath_sanitizesModelType() {
        Path path = storage().resultImagePath(tmp, "../forest fire");

        assertThat(path.getParent()).isEqualTo(tmp);
        assertThat(path.getFileName().toString()).matches("segmentation_result_\\.\\._forest_fire_\\d{8}_\\d{6}\\.jpg");
    }

    @Test
    void webPathFor_onlyServesOutputDirectory() {
        StorageService storage = storage();
        Path inside = storage.outputDir().resolve("segmentation_result_general_20240101_120000.jpg");

        assertThat(storage.webPathFor(inside.toString()))
                .contains("/results/segmentation_result_general_20240101_120000.jpg");
        assertThat(storage.webPathFor(tmp.resolve("elsewhere.jpg").toString())).isEmpty();
        assertThat(storage.webPathFor("")).isEmpty();
        assertThat(storage.webPathFor(storage.outputDir().toString())).isEmpty();
    }

    @Test
    void requestOutputDir_isFreshPerRequestAndServedBelowResults() {
        StorageService storage = storage();

        Path first = storage.requestOutputDir();
        Path second = storage.requestOutputDir();

        assertThat(first).isDirectory();
        assertThat(second).isDirectory().isNotEqualTo(first);
        assertThat(first.getParent()).isEqualTo(storage.outputDir());
        Path image = first.resolve("segmentation_result_water_20240101_120000.jpg");
        assertThat(storage.webPathFor(image.toString()))
                .contains("/results/" + first.getFileName() + "/segmentation_result_water_20240101_120000.jpg");
    }

    @Test
    void delete_removesStoredUpload() {
        StorageService storage = storage();
        var stored = storage.store(new MockMultipartFile("file", "a.png", "image/png", new byte[]{1, 2}));

        storage.delete(stored);
        storage.delete(stored);

        assertThat(stored.path()).doesNotExist();
    }

    @Test
    void outputDir_isCreatedOnFirstUse() {
        StorageService storage = storage();

        assertThat(storage.outputDir()).isDirectory();
    }
}
