package com.coffee.diagnosis.service.store;

import com.coffee.diagnosis.model.ModelType;

public record ModelSwappedEvent(ModelType modelType, String version) {
}
