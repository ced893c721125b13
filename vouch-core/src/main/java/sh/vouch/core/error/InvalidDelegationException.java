// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.error;

import java.util.Objects;

/**
 * Thrown when a delegation request is rejected before any state is written.
 *
 * @since 0.1.0
 */
public final class InvalidDelegationException extends VouchException {

    /**
     * Why the request was rejected.
     */
    public enum Reason {
        /** {@code to == from}. */
        SELF_DELEGATION,
        /** The NONE type is a lookup sentinel and cannot be stored. */
        NONE_TYPE,
        /** A field is missing, or set where the delegation type does not use it. */
        MALFORMED_SCOPE,
        /** Token id or amount is not a {@code uint256}. */
        OUT_OF_RANGE,
        /** A type code outside the known range. */
        UNKNOWN_TYPE
    }

    private final Reason reason;

    public InvalidDelegationException(final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
