package io.fhirrules.core.model;

import java.util.Objects;

/**
 * Which instances of the owning resource type a rule evaluates against.
 *
 * <p>
 * Sealed: the three variants are known at compile time.
 */
public sealed interface InstanceScope {

    /** Every instance, in document order. */
    InstanceScope ALL = new All();

    /** Only the first instance. */
    InstanceScope FIRST = new First();

    /**
     * Deterministic text identifying the scope, used by duplicate detection:
     * {@code all}, {@code first} or {@code filtered:<filter key>}.
     */
    String stableKey();

    /** Creates a filtered scope. */
    static InstanceScope filtered(ScopeFilter filter) {
        return new Filtered(filter);
    }

    // ── Variants ──

    /** Every instance of the owning resource type. */
    record All() implements InstanceScope {
        @Override
        public String stableKey() {
            return "all";
        }
    }

    /** The first instance only; empty when none exists. */
    record First() implements InstanceScope {
        @Override
        public String stableKey() {
            return "first";
        }
    }

    /** Instances on which {@code filter} holds. */
    record Filtered(ScopeFilter filter) implements InstanceScope {
        public Filtered {
            Objects.requireNonNull(filter, "filter must not be null");
        }

        @Override
        public String stableKey() {
            return "filtered:" + filter.stableKey();
        }
    }
}
