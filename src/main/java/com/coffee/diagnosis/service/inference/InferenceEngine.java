package com.coffee.diagnosis.service.inference;

import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.service.health.ComponentHealthCheck;
import com.coffee.diagnosis.service.store.ModelCatalog;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the active {@link ModelHandle} for one model type.
 *
 * <p>Forward passes run under the shared side of a read/write lock. A swap loads the new file
 * without holding the lock, then takes the exclusive side only to replace the reference, so slow
 * file I/O never blocks inference. The previous session is closed once the write lock is
 * released; by then no reader can still hold it.
 */
public class InferenceEngine implements ComponentHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(InferenceEngine.class);

    private final ModelType modelType;
    private final ModelLoader loader;
    private final ModelCatalog catalog;
    private final AtomicReference<ModelHandle> active = new AtomicReference<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong forwardPasses = new AtomicLong();
    private volatile String lastLoadError;

    public InferenceEngine(ModelType modelType, ModelLoader loader, ModelCatalog catalog) {
        this.modelType = modelType;
        this.loader = loader;
        this.catalog = catalog;
    }

    public ModelType modelType() {
        return modelType;
    }

    public boolean isReady() {
        return active.get() != null;
    }

    public Optional<ModelHandle> activeHandle() {
        return Optional.ofNullable(active.get());
    }

    public long forwardPassCount() {
        return forwardPasses.get();
    }

    /**
     * Loads the catalog's default file for this engine's model type. A missing file is logged and
     * leaves the engine in its current state.
     *
     * @return {@code true} when a model is active afterwards
     */
    public boolean tryLoadDefault() {
        try {
            reload();
            return true;
        } catch (ModelNotFoundException ex) {
            lastLoadError = ex.getMessage();
            log.warn("No {} model available, predictions will use fallback paths: {}", modelType, ex.getMessage());
        } catch (InferenceFailedException ex) {
            lastLoadError = ex.getMessage();
            log.error("Failed to load {} model", modelType, ex);
        }
        return isReady();
    }

    /**
     * Re-probes the catalog for this model type and swaps in what it finds.
     */
    public ModelHandle reload() {
        Path file = catalog.findModelFile(modelType);
        return swap(catalog.defaultVersion(modelType), file);
    }

    public ModelHandle swap(String version, Path modelFile) {
        ModelHandle candidate = loader.load(modelType, version, modelFile);
        ModelHandle previous;
        lock.writeLock().lock();
        try {
            previous = active.getAndSet(candidate);
        } finally {
            lock.writeLock().unlock();
        }
        lastLoadError = null;
        if (previous != null && previous.session() != candidate.session()) {
            previous.session().close();
        }
        log.info("Activated {} model {} (previous: {})", modelType, version,
                previous == null ? "none" : previous.version());
        catalog.onModelSwapped(modelType, version);
        return candidate;
    }

    /**
     * Encodes and runs one input against the handle active when the call starts. The encoder
     * receives that same handle so the tensor layout always matches the session it is fed to.
     *
     * @throws ModelNotFoundException when no model is loaded
     * @throws InferenceFailedException when the session produces no output
     */
    public InferenceOutput run(Function<ModelHandle, InputTensor> encoder) {
        lock.readLock().lock();
        try {
            ModelHandle handle = active.get();
            if (handle == null) {
                throw new ModelNotFoundException("No " + modelType + " model is loaded");
            }
            InputTensor tensor = encoder.apply(handle);
            float[] scores = handle.session().run(handle.inputName(), tensor.data(), tensor.shape());
            if (scores == null || scores.length == 0) {
                throw new InferenceFailedException("Model " + handle.version() + " returned no scores");
            }
            forwardPasses.incrementAndGet();
            return new InferenceOutput(handle, scores);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void close() {
        lock.writeLock().lock();
        ModelHandle previous;
        try {
            previous = active.getAndSet(null);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            previous.session().close();
        }
    }

    @Override
    public HealthStatus health() {
        String component = modelType.name().toLowerCase() + "-model";
        ModelHandle handle = active.get();
        if (handle == null) {
            return HealthStatus.down(component, lastLoadError == null ? "not loaded" : lastLoadError);
        }
        return HealthStatus.up(component, handle.version() + " (" + handle.layout() + ", "
                + forwardPasses.get() + " forward passes)");
    }
}
