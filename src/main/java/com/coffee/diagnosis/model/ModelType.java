package com.coffee.diagnosis.model;

import java.util.Locale;

public enum ModelType {
    IMAGE,
    SYMPTOM;

    public static ModelType parse(String value) {
        try {
            return ModelType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Unknown model type: " + value, ex);
        }
    }
}
