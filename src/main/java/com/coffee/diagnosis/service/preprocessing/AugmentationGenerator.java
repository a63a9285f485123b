package com.coffee.diagnosis.service.preprocessing;

import com.coffee.diagnosis.service.image.LeafImage;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.springframework.stereotype.Component;

/**
 * Renders the ensemble variants listed in {@link Augmentation}. Every variant is rendered from its
 * own copy of the base raster so no transform can leak into a sibling.
 */
@Component
public class AugmentationGenerator {

    static final double ROTATION_DEGREES = 2.0;
    static final double UP = 1.1;
    static final double DOWN = 0.9;

    public LeafImage apply(LeafImage base, Augmentation augmentation) {
        if (augmentation == Augmentation.IDENTITY) {
            return base;
        }
        Mat source = base.toMat();
        Mat result = null;
        try {
            result = switch (augmentation) {
                case ROTATE_CLOCKWISE -> rotate(source, -ROTATION_DEGREES);
                case ROTATE_COUNTER_CLOCKWISE -> rotate(source, ROTATION_DEGREES);
                case BRIGHTEN -> ImageEnhancer.scale(source, UP);
                case DARKEN -> ImageEnhancer.scale(source, DOWN);
                case CONTRAST_UP -> ImageEnhancer.adjustContrast(source, UP);
                case CONTRAST_DOWN -> ImageEnhancer.adjustContrast(source, DOWN);
                case SATURATE -> saturate(source, UP);
                case IDENTITY -> source.clone();
            };
            return LeafImage.fromMat(result);
        } finally {
            source.close();
            if (result != null) {
                result.close();
            }
        }
    }

    /** Positive angles rotate counter-clockwise, matching OpenCV. */
    static Mat rotate(Mat source, double degrees) {
        Point2f centre = new Point2f(source.cols() / 2f, source.rows() / 2f);
        Mat rotation = opencv_imgproc.getRotationMatrix2D(centre, degrees, 1.0);
        Mat result = new Mat();
        opencv_imgproc.warpAffine(source, result, rotation, source.size(), opencv_imgproc.INTER_LINEAR,
                opencv_core.BORDER_REFLECT, new Scalar(0, 0, 0, 0));
        rotation.close();
        centre.close();
        return result;
    }

    static Mat saturate(Mat rgb, double factor) {
        Mat hsv = new Mat();
        opencv_imgproc.cvtColor(rgb, hsv, opencv_imgproc.COLOR_RGB2HSV);
        MatVector channels = new MatVector();
        opencv_core.split(hsv, channels);
        Mat saturation = channels.get(1);
        Mat boosted = new Mat();
        saturation.convertTo(boosted, -1, factor, 0);
        channels.put(1, boosted);
        Mat merged = new Mat();
        opencv_core.merge(channels, merged);
        Mat result = new Mat();
        opencv_imgproc.cvtColor(merged, result, opencv_imgproc.COLOR_HSV2RGB);
        merged.close();
        hsv.close();
        channels.close();
        return result;
    }
}
