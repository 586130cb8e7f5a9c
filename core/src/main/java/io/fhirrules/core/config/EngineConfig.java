package io.fhirrules.core.config;

import io.fhirrules.core.model.FindingSource;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable engine configuration. Built via {@link #builder()} or loaded by
 * {@link EngineConfigLoader}.
 *
 * @param referencePolicy  treatment of unresolved references
 * @param enabledLayers    layers the engine runs; a layer not listed is
 *                         skipped even if registered
 * @param structuralSchema JSON Schema file for the structural layer, or
 *                         {@code null} when no structural layer is configured
 * @param telemetryEnabled whether telemetry events are delivered
 */
public record EngineConfig(
        ReferencePolicy referencePolicy,
        Set<FindingSource> enabledLayers,
        Path structuralSchema,
        boolean telemetryEnabled) {

    public EngineConfig {
        Objects.requireNonNull(referencePolicy, "referencePolicy must not be null");
        enabledLayers = enabledLayers == null || enabledLayers.isEmpty()
                ? Set.copyOf(EnumSet.allOf(FindingSource.class))
                : Set.copyOf(enabledLayers);
    }

    /** Configuration with every default applied. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether the given layer runs. */
    public boolean isEnabled(FindingSource layer) {
        return enabledLayers.contains(layer);
    }

    /** Builder with documented defaults. */
    public static final class Builder {
        private ReferencePolicy referencePolicy = ReferencePolicy.IN_BUNDLE_ONLY;
        private Set<FindingSource> enabledLayers = EnumSet.allOf(FindingSource.class);
        private Path structuralSchema;
        private boolean telemetryEnabled = true;

        private Builder() {}

        public Builder referencePolicy(ReferencePolicy referencePolicy) {
            this.referencePolicy = referencePolicy;
            return this;
        }

        public Builder enabledLayers(Set<FindingSource> enabledLayers) {
            this.enabledLayers = enabledLayers;
            return this;
        }

        public Builder structuralSchema(Path structuralSchema) {
            this.structuralSchema = structuralSchema;
            return this;
        }

        public Builder telemetryEnabled(boolean telemetryEnabled) {
            this.telemetryEnabled = telemetryEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(referencePolicy, enabledLayers, structuralSchema, telemetryEnabled);
        }
    }
}
