package com.coffee.diagnosis.service.preprocessing;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.service.features.EnvironmentalFactors;
import com.coffee.diagnosis.service.features.ImageAnalysis;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import com.coffee.diagnosis.service.image.LeafImage;
import java.util.ArrayList;
import java.util.List;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Corrects poorly exposed or soft images before they are augmented. The correction sequence is
 * fixed: contrast stretch, exposure correction toward the mid band, unsharp masking, then a mild
 * contrast lift for shadowed or glared scenes. Each step works on a fresh matrix.
 */
@Component
public class ImageEnhancer {

    private static final Logger log = LoggerFactory.getLogger(ImageEnhancer.class);

    static final double LOW_CONTRAST = 0.1;
    static final double CONTRAST_BOOST = 1.3;
    static final double MILD_CONTRAST_BOOST = 1.1;
    static final double MAX_BRIGHTNESS_GAIN = 2.5;

    private final double enhancementThreshold;

    public ImageEnhancer(DiagnosisProperties properties) {
        this.enhancementThreshold = properties.pipeline().enhancementThreshold();
    }

    public boolean needsEnhancement(QualityAnalysis quality) {
        return quality.qualityScore() < enhancementThreshold;
    }

    /**
     * Returns an enhanced copy, or the input itself when its quality score already clears the
     * threshold.
     */
    public LeafImage enhance(LeafImage image, ImageAnalysis analysis) {
        QualityAnalysis quality = analysis.quality();
        if (!needsEnhancement(quality)) {
            return image;
        }
        EnvironmentalFactors environment = analysis.environment();
        List<String> steps = new ArrayList<>();
        Mat current = image.toMat();
        try {
            if (quality.contrast() < LOW_CONTRAST) {
                current = replace(current, adjustContrast(current, CONTRAST_BOOST));
                steps.add("contrast");
            }
            double gain = brightnessGain(quality.averageBrightness());
            if (gain != 1.0) {
                current = replace(current, scale(current, gain));
                steps.add(String.format("brightness x%.2f", gain));
            }
            if (quality.blurry()) {
                current = replace(current, sharpen(current));
                steps.add("sharpen");
            }
            if (environment.hasShadow() || environment.hasHighlight()) {
                current = replace(current, adjustContrast(current, MILD_CONTRAST_BOOST));
                steps.add("lighting");
            }
            log.debug("Enhanced image with quality {} using steps {}", quality.qualityScore(), steps);
            return LeafImage.fromMat(current);
        } finally {
            current.close();
        }
    }

    /**
     * Gain that moves the mean brightness to the nearest edge of the {@code [0.3, 0.7]} band, or
     * {@code 1.0} when it is already inside.
     */
    static double brightnessGain(double brightness) {
        if (brightness < 0.3) {
            return Math.min(MAX_BRIGHTNESS_GAIN, 0.4 / Math.max(brightness, 0.05));
        }
        if (brightness > 0.7) {
            return 0.6 / brightness;
        }
        return 1.0;
    }

    static Mat adjustContrast(Mat source, double factor) {
        Mat result = new Mat();
        source.convertTo(result, -1, factor, 127.5 * (1.0 - factor));
        return result;
    }

    static Mat scale(Mat source, double factor) {
        Mat result = new Mat();
        source.convertTo(result, -1, factor, 0);
        return result;
    }

    static Mat sharpen(Mat source) {
        Mat blurred = new Mat();
        Mat result = new Mat();
        opencv_imgproc.GaussianBlur(source, blurred, new Size(3, 3), 0);
        opencv_core.addWeighted(source, 1.5, blurred, -0.5, 0, result);
        blurred.close();
        return result;
    }

    private static Mat replace(Mat previous, Mat next) {
        previous.close();
        return next;
    }
}
