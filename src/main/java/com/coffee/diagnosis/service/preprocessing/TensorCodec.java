package com.coffee.diagnosis.service.preprocessing;

import com.coffee.diagnosis.service.image.LeafImage;
import com.coffee.diagnosis.service.inference.InputTensor;
import com.coffee.diagnosis.service.inference.ModelHandle;
import com.coffee.diagnosis.service.inference.TensorLayout;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Component;

/**
 * Turns an RGB image into the float tensor the active image model expects. The layout and the
 * spatial size both come from the handle.
 */
@Component
public class TensorCodec {

    static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    static final float[] STD = {0.229f, 0.224f, 0.225f};

    public InputTensor encode(LeafImage image, ModelHandle handle) {
        TensorLayout layout = handle.layout();
        if (layout == TensorLayout.FLAT) {
            throw new IllegalArgumentException("Model " + handle.version() + " does not take image input");
        }
        LeafImage resized = resize(image, handle.inputWidth(), handle.inputHeight());
        return layout == TensorLayout.CHANNEL_FIRST ? channelFirst(resized) : channelLast(resized);
    }

    static InputTensor channelFirst(LeafImage image) {
        int width = image.width();
        int height = image.height();
        int plane = width * height;
        float[] data = new float[plane * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int offset = y * width + x;
                data[offset] = (image.red(x, y) / 255f - MEAN[0]) / STD[0];
                data[plane + offset] = (image.green(x, y) / 255f - MEAN[1]) / STD[1];
                data[2 * plane + offset] = (image.blue(x, y) / 255f - MEAN[2]) / STD[2];
            }
        }
        return new InputTensor(data, new long[] {1, 3, height, width});
    }

    static InputTensor channelLast(LeafImage image) {
        int width = image.width();
        int height = image.height();
        float[] data = new float[width * height * 3];
        int index = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[index++] = image.red(x, y) / 255f;
                data[index++] = image.green(x, y) / 255f;
                data[index++] = image.blue(x, y) / 255f;
            }
        }
        return new InputTensor(data, new long[] {1, height, width, 3});
    }

    static LeafImage resize(LeafImage image, int width, int height) {
        if (image.width() == width && image.height() == height) {
            return image;
        }
        Mat source = image.toMat();
        Mat resized = new Mat();
        try {
            opencv_imgproc.resize(source, resized, new Size(width, height), 0, 0, opencv_imgproc.INTER_LINEAR);
            return LeafImage.fromMat(resized);
        } finally {
            resized.close();
            source.close();
        }
    }
}
