package com.coffee.diagnosis.service.store;

import com.coffee.diagnosis.model.ModelType;
import java.nio.file.Path;

/**
 * Locates model files and hears about committed swaps.
 */
public interface ModelCatalog {

    /**
     * @throws com.coffee.diagnosis.service.inference.ModelNotFoundException when no candidate exists
     */
    Path findModelFile(ModelType type);

    Path findModelFile(String fileName);

    String defaultVersion(ModelType type);

    void onModelSwapped(ModelType type, String version);
}
