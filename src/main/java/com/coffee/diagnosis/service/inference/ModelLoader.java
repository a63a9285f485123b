package com.coffee.diagnosis.service.inference;

import com.coffee.diagnosis.model.ModelType;
import java.nio.file.Path;

@FunctionalInterface
public interface ModelLoader {

    ModelHandle load(ModelType type, String version, Path modelFile);
}
