package com.coffee.diagnosis.service.image;

import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bridges raw upload bytes and {@link LeafImage} through the OpenCV codecs.
 */
@Component
public class ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    public LeafImage decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new DecodeFailedException("Image payload is empty");
        }
        Mat encoded = new Mat(imageBytes);
        Mat bgr;
        try {
            bgr = opencv_imgcodecs.imdecode(encoded, opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException ex) {
            throw new DecodeFailedException("Unable to decode image payload", ex);
        } finally {
            encoded.close();
        }
        if (bgr == null || bgr.empty()) {
            throw new DecodeFailedException("Unable to decode image payload");
        }
        Mat rgb = new Mat();
        try {
            opencv_imgproc.cvtColor(bgr, rgb, opencv_imgproc.COLOR_BGR2RGB);
            LeafImage image = LeafImage.fromMat(rgb);
            log.debug("Decoded {} byte payload into {}x{} image", imageBytes.length, image.width(), image.height());
            return image;
        } finally {
            rgb.close();
            bgr.close();
        }
    }
}
