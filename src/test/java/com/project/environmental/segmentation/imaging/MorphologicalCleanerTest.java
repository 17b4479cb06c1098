package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.TestRasters;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import static org.assertj.core.api.Assertions.assertThat;

class MorphologicalCleanerTest {
    private final MorphologicalCleaner cleaner = new MorphologicalCleaner();

    @BeforeAll
    static void loadOpenCv() {
        TestRasters.requireOpenCv();
    }

    @Test
    void close_bridgesGapNarrowerThanKernel() {
        Mat mask = Mat.zeros(50, 50, CvType.CV_8UC1);
        square(mask, 10, 10, 10);
        square(mask, 22, 10, 10); // two-pixel gap

        Mat closed = cleaner.close(mask, 5);

        assertThat(closed.get(15, 20)[0]).isEqualTo(255.0);
        assertThat(closed.get(15, 21)[0]).isEqualTo(255.0);
        assertThat(mask.get(15, 20)[0]).as("input untouched").isEqualTo(0.0);
    }

    @Test
    void open_removesSpeckles_keepsLargeBlocks() {
        Mat mask = Mat.zeros(50, 50, CvType.CV_8UC1);
        square(mask, 10, 10, 20);
        mask.put(40, 40, 255);
        mask.put(5, 45, 255);

        Mat opened = cleaner.open(mask, 5);

        assertThat(Core.countNonZero(opened)).isEqualTo(400);
    }

    @Test
    void closeThenOpen_keepsSolidRectangleUnchanged() {
        Mat mask = Mat.zeros(80, 80, CvType.CV_8UC1);
        square(mask, 10, 10, 40);

        Mat cleaned = cleaner.closeThenOpen(mask, 5);

        assertThat(Core.countNonZero(cleaned)).isEqualTo(1600);
    }

    @Test
    void emptyMask_isNoOp() {
        assertThat(cleaner.close(new Mat(), 7).empty()).isTrue();
    }

    private static void square(Mat mask, int x, int y, int size) {
        Imgproc.rectangle(mask, new Point(x, y), new Point(x + size - 1, y + size - 1), new Scalar(255), Imgproc.FILLED);
    }
}
