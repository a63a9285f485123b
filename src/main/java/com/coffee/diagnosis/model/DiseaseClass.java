package com.coffee.diagnosis.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of labels the image and symptom classifiers emit. Declaration order matches the
 * output index order of the trained models.
 */
public enum DiseaseClass {

    CERCOSPORA("Cercospora"),
    HEALTHY("Healthy"),
    MINER("Miner"),
    PHOMA("Phoma"),
    RUST("Rust");

    /** Label reported when an image fails the coffee-leaf plausibility gate. */
    public static final String NOT_COFFEE_LEAF = "Not Coffee Leaf";

    private final String label;

    DiseaseClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DiseaseClass fromIndex(int index) {
        DiseaseClass[] values = values();
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException("No disease class at index " + index);
        }
        return values[index];
    }

    public static Optional<DiseaseClass> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(value -> value.label.equalsIgnoreCase(label.trim()))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(DiseaseClass::label).toList();
    }

    public static boolean isKnownLabel(String label) {
        return NOT_COFFEE_LEAF.equals(label) || fromLabel(label).isPresent();
    }
}
