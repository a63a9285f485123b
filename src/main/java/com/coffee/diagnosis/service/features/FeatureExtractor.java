package com.coffee.diagnosis.service.features;

import com.coffee.diagnosis.service.image.LeafImage;
import org.springframework.stereotype.Component;

/**
 * Pure numeric analysis of a decoded image. Each metric walks the raster on its own so that the
 * output of any single metric is independent of which other metrics were requested.
 *
 * <p>Luminance is the channel mean {@code (R + G + B) / 3}. Hue is reported in degrees on the
 * full {@code [0, 360)} colour wheel; saturation and value are in {@code [0, 1]}.
 *
 * <p>The coffee-leaf score subtracts the weight of every unmet criterion instead of only adding
 * the met ones; with additions alone it could never drop below 0.5 and the 0.3 leaf gate would
 * never reject anything.
 */
@Component
public class FeatureExtractor {

    static final double BLUR_THRESHOLD = 0.02;
    static final double EDGE_DELTA = 30.0;
    static final double SHADOW_LUMINANCE = 50.0;
    static final double HIGHLIGHT_LUMINANCE = 230.0;

    public ImageAnalysis analyze(LeafImage image) {
        QualityAnalysis quality = analyzeQuality(image);
        EnvironmentalFactors environment = analyzeEnvironment(image);
        LeafFeatures leaf = extractLeafFeatures(image, environment);
        return new ImageAnalysis(quality, leaf, environment);
    }

    public QualityAnalysis analyzeQuality(LeafImage image) {
        int width = image.width();
        int height = image.height();
        int count = image.pixelCount();

        double sum = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sum += image.luminance(x, y);
            }
        }
        double mean = sum / count;

        double squaredDeviation = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double delta = image.luminance(x, y) - mean;
                squaredDeviation += delta * delta;
            }
        }
        double brightness = mean / 255.0;
        double contrast = Math.sqrt(squaredDeviation / count) / 255.0;
        double sharpness = laplacianRms(image) / 255.0;
        double score = qualityScore(brightness, contrast, sharpness);
        return new QualityAnalysis(
                brightness,
                contrast,
                sharpness,
                score,
                sharpness < BLUR_THRESHOLD,
                brightness < 0.2 || brightness > 0.8);
    }

    public EnvironmentalFactors analyzeEnvironment(LeafImage image) {
        int width = image.width();
        int height = image.height();
        int count = image.pixelCount();
        int shadow = 0;
        int highlight = 0;
        int edges = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double luminance = image.luminance(x, y);
                if (luminance < SHADOW_LUMINANCE) {
                    shadow++;
                } else if (luminance > HIGHLIGHT_LUMINANCE) {
                    highlight++;
                }
                if (x + 1 < width && y + 1 < height
                        && Math.abs(luminance - image.luminance(x + 1, y + 1)) > EDGE_DELTA) {
                    edges++;
                }
            }
        }
        double shadowRatio = (double) shadow / count;
        double highlightRatio = (double) highlight / count;
        double edgeRatio = (double) edges / count;
        return new EnvironmentalFactors(
                shadowRatio > 0.2,
                highlightRatio > 0.1,
                edgeRatio > 0.3,
                shadowRatio,
                highlightRatio,
                edgeRatio);
    }

    public LeafFeatures extractLeafFeatures(LeafImage image, EnvironmentalFactors environment) {
        int width = image.width();
        int height = image.height();
        int count = image.pixelCount();

        int green = 0;
        int brown = 0;
        int yellow = 0;
        double hueSum = 0.0;
        double saturationSum = 0.0;
        double valueSum = 0.0;
        float[] hsv = new float[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                toHsv(image.red(x, y), image.green(x, y), image.blue(x, y), hsv);
                hueSum += hsv[0];
                saturationSum += hsv[1];
                valueSum += hsv[2];
                switch (colourBand(hsv[0], hsv[1])) {
                    case YELLOW -> yellow++;
                    case GREEN -> green++;
                    case BROWN -> brown++;
                    default -> {
                    }
                }
            }
        }

        double greenRatio = (double) green / count;
        double brownRatio = (double) brown / count;
        double yellowRatio = (double) yellow / count;
        double avgSaturation = saturationSum / count;
        double texture = texture(image);
        double shapeComplexity = shapeComplexity(image);
        double edgeDensity = edgeDensity(image);
        double leafScore = coffeeLeafScore(greenRatio, brownRatio, avgSaturation, texture, shapeComplexity,
                edgeDensity, environment);
        return new LeafFeatures(
                greenRatio,
                brownRatio,
                yellowRatio,
                hueSum / count,
                avgSaturation,
                valueSum / count,
                texture,
                shapeComplexity,
                edgeDensity,
                leafScore);
    }

    static double qualityScore(double brightness, double contrast, double sharpness) {
        double score = 0.5;
        if (brightness >= 0.3 && brightness <= 0.7) {
            score += 0.2;
        } else {
            score -= Math.abs(brightness - 0.5) * 0.4;
        }
        score += Math.min(contrast * 2.0, 0.3);
        score += Math.min(sharpness * 10.0, 0.2);
        return clamp(score, 0.0, 1.0);
    }

    /**
     * Every criterion moves the score by its weight: up when the image satisfies it, down when it
     * does not. An image that fails them all therefore lands well under the leaf gate.
     */
    static double coffeeLeafScore(double greenRatio, double brownRatio, double avgSaturation, double texture,
            double shapeComplexity, double edgeDensity, EnvironmentalFactors environment) {
        double score = 0.5;
        score += criterion(greenRatio > 0.3 || brownRatio > 0.2, 0.15);
        score += criterion(avgSaturation > 0.3, 0.15);
        score += criterion(texture > 10 && texture < 100, 0.2);
        score += criterion(shapeComplexity > 5 && shapeComplexity < 50, 0.2);
        score += criterion(edgeDensity > 0.1 && edgeDensity < 0.4, 0.15);
        score += criterion(!environment.complexBackground(), 0.1);
        score += criterion(!environment.hasShadow() && !environment.hasHighlight(), 0.05);
        return clamp(score, 0.0, 1.0);
    }

    private static double criterion(boolean satisfied, double weight) {
        return satisfied ? weight : -weight;
    }

    private static double laplacianRms(LeafImage image) {
        int width = image.width();
        int height = image.height();
        if (width < 3 || height < 3) {
            return 0.0;
        }
        double sum = 0.0;
        long count = 0;
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                double laplacian = 4 * image.luminance(x, y)
                        - image.luminance(x - 1, y)
                        - image.luminance(x + 1, y)
                        - image.luminance(x, y - 1)
                        - image.luminance(x, y + 1);
                sum += laplacian * laplacian;
                count++;
            }
        }
        return Math.sqrt(sum / count);
    }

    private static double texture(LeafImage image) {
        int width = image.width();
        int height = image.height();
        if (width < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 1; x < width; x++) {
                sum += Math.abs(image.red(x, y) - image.red(x - 1, y))
                        + Math.abs(image.green(x, y) - image.green(x - 1, y))
                        + Math.abs(image.blue(x, y) - image.blue(x - 1, y));
            }
        }
        return sum / ((long) (width - 1) * height);
    }

    private static double shapeComplexity(LeafImage image) {
        int width = image.width();
        int height = image.height();
        if (width < 3 || height < 3) {
            return 0.0;
        }
        double sum = 0.0;
        long count = 0;
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                double centre = image.luminance(x, y);
                double deviation = 0.0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        if (dx != 0 || dy != 0) {
                            deviation += Math.abs(centre - image.luminance(x + dx, y + dy));
                        }
                    }
                }
                sum += deviation;
                count++;
            }
        }
        return sum / count;
    }

    private static double edgeDensity(LeafImage image) {
        int width = image.width();
        int height = image.height();
        int edges = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double luminance = image.luminance(x, y);
                boolean right = x + 1 < width && Math.abs(luminance - image.luminance(x + 1, y)) > EDGE_DELTA;
                boolean below = y + 1 < height && Math.abs(luminance - image.luminance(x, y + 1)) > EDGE_DELTA;
                if (right || below) {
                    edges++;
                }
            }
        }
        return (double) edges / image.pixelCount();
    }

    /** Yellow is tested first because its band sits inside the green hue band. */
    static ColourBand colourBand(double hue, double saturation) {
        if (hue >= 45 && hue <= 65 && saturation > 0.6) {
            return ColourBand.YELLOW;
        }
        if (hue >= 35 && hue <= 85 && saturation > 0.3) {
            return ColourBand.GREEN;
        }
        if (hue >= 15 && hue <= 35) {
            return ColourBand.BROWN;
        }
        return ColourBand.OTHER;
    }

    static void toHsv(int red, int green, int blue, float[] out) {
        float r = red / 255f;
        float g = green / 255f;
        float b = blue / 255f;
        float max = Math.max(r, Math.max(g, b));
        float min = Math.min(r, Math.min(g, b));
        float delta = max - min;
        float hue;
        if (delta == 0f) {
            hue = 0f;
        } else if (max == r) {
            hue = 60f * (((g - b) / delta) % 6f);
        } else if (max == g) {
            hue = 60f * (((b - r) / delta) + 2f);
        } else {
            hue = 60f * (((r - g) / delta) + 4f);
        }
        if (hue < 0f) {
            hue += 360f;
        }
        out[0] = hue >= 360f ? 0f : hue;
        out[1] = max == 0f ? 0f : delta / max;
        out[2] = max;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    enum ColourBand {
        GREEN,
        BROWN,
        YELLOW,
        OTHER
    }
}
