package com.coffee.diagnosis.service.store;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.service.inference.ModelNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Finds model files by probing the configured directories in order. Committed swaps are
 * re-published as {@link ModelSwappedEvent}s.
 */
public class FileSystemModelCatalog implements ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(FileSystemModelCatalog.class);

    private final List<Path> directories;
    private final DiagnosisProperties.ModelProperties properties;
    private final ApplicationEventPublisher events;

    public FileSystemModelCatalog(DiagnosisProperties.ModelProperties properties, ApplicationEventPublisher events) {
        this.properties = properties;
        this.events = events;
        this.directories = properties.directories().stream().map(Path::of).toList();
    }

    @Override
    public Path findModelFile(ModelType type) {
        return findModelFile(type == ModelType.IMAGE ? properties.imageFile() : properties.symptomFile());
    }

    @Override
    public Path findModelFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Model file name must not be blank");
        }
        Path name = Path.of(fileName).getFileName();
        if (!name.toString().equals(fileName)) {
            throw new IllegalArgumentException("Model file name must not contain a path: " + fileName);
        }
        List<String> probed = new ArrayList<>();
        for (Path directory : directories) {
            Path candidate = directory.resolve(name);
            probed.add(candidate.toAbsolutePath().toString());
            if (Files.isRegularFile(candidate)) {
                log.debug("Resolved model file {} to {}", fileName, candidate.toAbsolutePath());
                return candidate;
            }
        }
        throw new ModelNotFoundException("Model file " + fileName + " not found, probed " + probed);
    }

    @Override
    public String defaultVersion(ModelType type) {
        return type == ModelType.IMAGE ? properties.imageVersion() : properties.symptomVersion();
    }

    @Override
    public void onModelSwapped(ModelType type, String version) {
        events.publishEvent(new ModelSwappedEvent(type, version));
    }
}
