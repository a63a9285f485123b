package com.coffee.diagnosis.service.image;

import java.util.Arrays;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Decoded 8-bit RGB raster. Pixels are stored interleaved row by row. The backing array is
 * copied on the way in and on the way out, so an instance can be shared between augmentation
 * branches without any of them seeing another's edits.
 */
public final class LeafImage {

    private final int width;
    private final int height;
    private final byte[] rgb;

    private LeafImage(int width, int height, byte[] rgb) {
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    public static LeafImage of(int width, int height, byte[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
        if (rgb == null || rgb.length != width * height * 3) {
            throw new IllegalArgumentException("Expected " + (width * height * 3) + " RGB bytes");
        }
        return new LeafImage(width, height, Arrays.copyOf(rgb, rgb.length));
    }

    /**
     * Copies an 8-bit three channel RGB matrix. The matrix is not closed.
     */
    public static LeafImage fromMat(Mat rgbMat) {
        if (rgbMat == null || rgbMat.empty()) {
            throw new IllegalArgumentException("Matrix must not be empty");
        }
        if (rgbMat.type() != opencv_core.CV_8UC3) {
            throw new IllegalArgumentException("Expected CV_8UC3 matrix but got type " + rgbMat.type());
        }
        Mat continuous = rgbMat.isContinuous() ? rgbMat : rgbMat.clone();
        byte[] data = new byte[continuous.rows() * continuous.cols() * 3];
        continuous.data().get(data);
        if (continuous != rgbMat) {
            continuous.close();
        }
        return new LeafImage(rgbMat.cols(), rgbMat.rows(), data);
    }

    /**
     * Creates a fresh RGB matrix holding a copy of the pixels. Callers own and close it.
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, opencv_core.CV_8UC3);
        mat.data().put(rgb);
        return mat;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public int red(int x, int y) {
        return rgb[(y * width + x) * 3] & 0xFF;
    }

    public int green(int x, int y) {
        return rgb[(y * width + x) * 3 + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return rgb[(y * width + x) * 3 + 2] & 0xFF;
    }

    /** Mean of the three channels, in [0, 255]. */
    public double luminance(int x, int y) {
        int offset = (y * width + x) * 3;
        return ((rgb[offset] & 0xFF) + (rgb[offset + 1] & 0xFF) + (rgb[offset + 2] & 0xFF)) / 3.0;
    }

    public byte[] rgbBytes() {
        return Arrays.copyOf(rgb, rgb.length);
    }
}
