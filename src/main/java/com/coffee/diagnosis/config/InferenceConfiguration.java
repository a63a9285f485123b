package com.coffee.diagnosis.config;

import ai.onnxruntime.OrtEnvironment;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.ModelLoader;
import com.coffee.diagnosis.service.inference.OnnxModelLoader;
import com.coffee.diagnosis.service.store.FileSystemModelCatalog;
import com.coffee.diagnosis.service.store.ModelCatalog;
import com.coffee.diagnosis.service.symptom.SymptomClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one {@link InferenceEngine} per model type on a shared ONNX Runtime environment. Models
 * load eagerly when configured to; a missing file leaves the engine empty and predictions fall
 * back to the mock and rule paths.
 */
@Configuration
public class InferenceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InferenceConfiguration.class);

    private InferenceEngine imageEngine;
    private InferenceEngine symptomEngine;

    @Bean
    public OrtEnvironment ortEnvironment() {
        return OrtEnvironment.getEnvironment();
    }

    @Bean
    public ModelCatalog modelCatalog(DiagnosisProperties properties, ApplicationEventPublisher events) {
        return new FileSystemModelCatalog(properties.model(), events);
    }

    @Bean
    public ModelLoader modelLoader(OrtEnvironment environment, DiagnosisProperties properties) {
        return new OnnxModelLoader(environment, properties.model().inputSize(),
                SymptomClassifier.DEFAULT_FEATURE_LENGTH);
    }

    @Bean
    public InferenceEngine imageInferenceEngine(ModelLoader loader, ModelCatalog catalog,
            DiagnosisProperties properties) {
        imageEngine = new InferenceEngine(ModelType.IMAGE, loader, catalog);
        if (properties.model().loadOnStartup()) {
            imageEngine.tryLoadDefault();
        }
        return imageEngine;
    }

    @Bean
    public InferenceEngine symptomInferenceEngine(ModelLoader loader, ModelCatalog catalog,
            DiagnosisProperties properties) {
        symptomEngine = new InferenceEngine(ModelType.SYMPTOM, loader, catalog);
        if (properties.model().loadOnStartup()) {
            symptomEngine.tryLoadDefault();
        }
        return symptomEngine;
    }

    @Bean
    public SymptomClassifier symptomClassifier(InferenceEngine symptomInferenceEngine) {
        return new SymptomClassifier(symptomInferenceEngine);
    }

    @PreDestroy
    public void close() {
        if (imageEngine != null) {
            imageEngine.close();
        }
        if (symptomEngine != null) {
            symptomEngine.close();
        }
        log.debug("Closed inference engines");
    }
}
