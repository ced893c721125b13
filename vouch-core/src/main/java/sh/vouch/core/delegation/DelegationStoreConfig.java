// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.util.Objects;

/**
 * Configuration for {@link InMemoryDelegationStore}.
 *
 * <pre>{@code
 * DelegationStoreConfig config = DelegationStoreConfig.builder()
 *     .initialCapacity(10_000)
 *     .scopeValidation(ScopeValidation.NORMALIZE)
 *     .build();
 * }</pre>
 *
 * @param initialCapacity expected number of identities; sizes the backing maps (must be &gt; 0)
 * @param scopeValidation how fields a delegation type does not use are treated
 * @since 0.1.0
 */
public record DelegationStoreConfig(int initialCapacity, ScopeValidation scopeValidation) {

    /** Default initial capacity: 64. */
    public static final int DEFAULT_INITIAL_CAPACITY = 64;

    /**
     * Treatment of fields set where the delegation type ignores them, for example a
     * token id on a wallet-level delegation.
     */
    public enum ScopeValidation {
        /** Reject the request with {@code MALFORMED_SCOPE}. */
        STRICT,
        /** Zero the ignored fields and accept. Missing required fields are still rejected. */
        NORMALIZE
    }

    public DelegationStoreConfig {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0, got: " + initialCapacity);
        }
        Objects.requireNonNull(scopeValidation, "scopeValidation");
    }

    /**
     * @return {@code (64, STRICT)}
     */
    public static DelegationStoreConfig defaults() {
        return new DelegationStoreConfig(DEFAULT_INITIAL_CAPACITY, ScopeValidation.STRICT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
        private ScopeValidation scopeValidation = ScopeValidation.STRICT;

        private Builder() {
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder scopeValidation(ScopeValidation scopeValidation) {
            this.scopeValidation = scopeValidation;
            return this;
        }

        public DelegationStoreConfig build() {
            return new DelegationStoreConfig(initialCapacity, scopeValidation);
        }
    }
}
