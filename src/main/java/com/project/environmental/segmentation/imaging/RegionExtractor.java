package com.project.environmental.segmentation.imaging;

import com.project.environmental.segmentation.DTOs.BoundingBox;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the outer contours of a binary mask and measures each enclosed region.
 */
@Component
public class RegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    public List<Region> extract(Mat mask) {
        if (mask.empty()) {
            return List.of();
        }
        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = new Mat();
        Imgproc.findContours(mask, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
        hierarchy.release();

        List<Region> regions = new ArrayList<>(contours.size());
        for (MatOfPoint contour : contours) {
            Rect rect = Imgproc.boundingRect(contour);
            int area = filledArea(contour, rect);
            regions.add(new Region(new BoundingBox(rect.x, rect.y, rect.width, rect.height), area));
            contour.release();
        }
        log.debug("Extracted {} region(s) from {}x{} mask", regions.size(), mask.cols(), mask.rows());
        return regions;
    }

    // Rasterizes the contour into a box-sized canvas so holes count towards the area.
    private static int filledArea(MatOfPoint contour, Rect rect) {
        Mat canvas = Mat.zeros(rect.height, rect.width, CvType.CV_8UC1);
        Imgproc.drawContours(canvas, List.of(contour), 0, new Scalar(255), Imgproc.FILLED,
                Imgproc.LINE_8, new Mat(), 0, new Point(-rect.x, -rect.y));
        int area = Core.countNonZero(canvas);
        canvas.release();
        return area;
    }
}
