package com.coffee.diagnosis.service;

import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Human readable text attached to each label.
 */
@Component
public class DiseaseKnowledgeBase {

    private static final String UNKNOWN_DESCRIPTION = "No description is available for this label.";
    private static final String UNKNOWN_TREATMENT = "Consult a local agronomist for a field inspection.";

    private final Map<DiseaseClass, String> descriptions = new EnumMap<>(DiseaseClass.class);
    private final Map<DiseaseClass, String> treatments = new EnumMap<>(DiseaseClass.class);

    public DiseaseKnowledgeBase() {
        descriptions.put(DiseaseClass.CERCOSPORA, "Cercospora leaf spot: small brown spots with pale centres that "
                + "spread across the blade and can cause early leaf drop.");
        descriptions.put(DiseaseClass.HEALTHY, "Healthy coffee leaf: no visible signs of disease, the leaf keeps "
                + "its natural green colour.");
        descriptions.put(DiseaseClass.MINER, "Leaf miner: larvae tunnel inside the leaf and leave pale winding "
                + "trails that reduce photosynthesis.");
        descriptions.put(DiseaseClass.PHOMA, "Phoma leaf blight: dark irregular lesions, often at the leaf tips "
                + "and margins, favoured by cool and wet weather.");
        descriptions.put(DiseaseClass.RUST, "Coffee leaf rust: yellow to orange powdery pustules on the underside "
                + "of the leaf, one of the most damaging coffee diseases.");

        treatments.put(DiseaseClass.CERCOSPORA, "Apply a copper-based fungicide, remove infected leaves and "
                + "improve plant nutrition, especially nitrogen and potassium.");
        treatments.put(DiseaseClass.HEALTHY, "Keep up regular care: balanced fertiliser, adequate watering and "
                + "periodic inspection for early symptoms.");
        treatments.put(DiseaseClass.MINER, "Remove and destroy mined leaves, encourage natural predators and use "
                + "a targeted systemic insecticide when infestation is high.");
        treatments.put(DiseaseClass.PHOMA, "Prune affected shoots, improve airflow through the canopy and apply a "
                + "protective fungicide before the rainy season.");
        treatments.put(DiseaseClass.RUST, "Spray a copper or triazole fungicide, collect fallen leaves and "
                + "consider rust-resistant varieties for replanting.");
    }

    public String describe(String diseaseName) {
        return DiseaseClass.fromLabel(diseaseName).map(descriptions::get).orElse(UNKNOWN_DESCRIPTION);
    }

    public String treatment(String diseaseName) {
        return DiseaseClass.fromLabel(diseaseName).map(treatments::get).orElse(UNKNOWN_TREATMENT);
    }

    /**
     * Description plus a note on how much the image quality lets the result be trusted.
     */
    public String describeWithQuality(String diseaseName, QualityAnalysis quality) {
        String description = describe(diseaseName);
        if (quality.qualityScore() > 0.8) {
            return description + " Image quality is good, the prediction is reliable.";
        }
        if (quality.qualityScore() < 0.5) {
            return description + " Image quality is poor; retake a sharper photo for a more accurate result.";
        }
        return description;
    }

    public List<String> qualityWarnings(QualityAnalysis quality) {
        List<String> warnings = new ArrayList<>();
        if (quality.averageBrightness() < 0.2) {
            warnings.add("image is too dark, shoot in brighter light");
        } else if (quality.averageBrightness() > 0.8) {
            warnings.add("image is too bright and may be overexposed");
        }
        if (quality.contrast() < 0.1) {
            warnings.add("image lacks contrast");
        }
        if (quality.blurry()) {
            warnings.add("image is not sharp enough, retake it");
        }
        return warnings;
    }

    public String notCoffeeLeafDescription(double leafScore) {
        return String.format("The image does not look like a coffee leaf (leaf score %.2f). Photograph a single "
                + "leaf against a plain background and try again.", leafScore);
    }

    public String notCoffeeLeafTreatment() {
        return "No treatment suggested.";
    }
}
