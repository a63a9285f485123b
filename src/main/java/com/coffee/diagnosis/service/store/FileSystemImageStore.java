package com.coffee.diagnosis.service.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps uploads as flat files named by a random reference.
 */
public class FileSystemImageStore implements ImageStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);
    private static final Pattern REFERENCE = Pattern.compile("[0-9a-f]{32}");

    private final Path directory;

    public FileSystemImageStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public String save(byte[] imageBytes) {
        String imageRef = UUID.randomUUID().toString().replace("-", "");
        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(imageRef), imageBytes);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to store image " + imageRef, ex);
        }
        log.debug("Stored {} bytes as image {}", imageBytes.length, imageRef);
        return imageRef;
    }

    @Override
    public byte[] read(String imageRef) {
        if (imageRef == null || !REFERENCE.matcher(imageRef).matches()) {
            throw new ImageNotFoundException("Invalid image reference: " + imageRef);
        }
        Path file = directory.resolve(imageRef);
        if (!Files.isRegularFile(file)) {
            throw new ImageNotFoundException("No stored image " + imageRef);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read image " + imageRef, ex);
        }
    }
}
