package com.coffee.diagnosis.api;

import com.coffee.diagnosis.config.DiagnosisProperties;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Rejects uploads that are empty, too large or not one of the accepted image types.
 */
@Component
public class UploadValidator {

    private final long maxImageBytes;
    private final List<String> allowedContentTypes;

    public UploadValidator(DiagnosisProperties properties) {
        this.maxImageBytes = properties.storage().maxImageBytes();
        this.allowedContentTypes = properties.storage().allowedContentTypes();
    }

    public byte[] readValidated(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image must not be empty");
        }
        if (image.getSize() > maxImageBytes) {
            throw new IllegalArgumentException("Uploaded image exceeds " + (maxImageBytes / (1024 * 1024)) + " MB");
        }
        String contentType = image.getContentType();
        if (contentType == null || !allowedContentTypes.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unsupported image type " + contentType + ", expected one of "
                    + allowedContentTypes);
        }
        try {
            return image.getBytes();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image", ex);
        }
    }
}
