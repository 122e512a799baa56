package com.chicu.trafficvolume.ml;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of the one-time model load at startup. Immutable; there is no reload.
 */
public final class ModelState {

    private final Predictor predictor;
    private final String artifact;
    private final String reason;
    private final Instant loadedAt;

    private ModelState(Predictor predictor, String artifact, String reason, Instant loadedAt) {
        this.predictor = predictor;
        this.artifact = artifact;
        this.reason = reason;
        this.loadedAt = loadedAt;
    }

    public static ModelState loaded(Predictor predictor, String artifact, Instant loadedAt) {
        if (predictor == null) throw new IllegalArgumentException("predictor is null");
        return new ModelState(predictor, artifact, null, loadedAt);
    }

    public static ModelState unloaded(String artifact, String reason) {
        return new ModelState(null, artifact, reason, null);
    }

    public boolean isLoaded() {
        return predictor != null;
    }

    public Optional<Predictor> predictor() {
        return Optional.ofNullable(predictor);
    }

    public String artifact() {
        return artifact;
    }

    /** Why the model is not loaded; {@code null} when loaded. */
    public String reason() {
        return reason;
    }

    public Optional<Instant> loadedAt() {
        return Optional.ofNullable(loadedAt);
    }

    @Override
    public String toString() {
        return isLoaded()
                ? "ModelState[loaded artifact=" + artifact + " at=" + loadedAt + "]"
                : "ModelState[unloaded artifact=" + artifact + " reason=" + reason + "]";
    }
}
