// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import sh.vouch.core.error.InvalidDelegationException;

/**
 * Granularity of a delegation.
 *
 * <p>The numeric {@link #code()} is folded into the low byte of every delegation
 * identity, so the ordinal order here is part of the identity scheme and must not
 * change.
 *
 * @since 0.1.0
 */
public enum DelegationType {
    /** No record. Returned by lookups that miss, never stored. */
    NONE,
    /** Entire wallet. */
    ALL,
    /** Every asset of one contract. */
    CONTRACT,
    /** One ERC721 token. */
    ERC721,
    /** An ERC20 balance of one contract. */
    ERC20,
    /** One ERC1155 token id. */
    ERC1155;

    private static final DelegationType[] VALUES = values();

    public int code() {
        return ordinal();
    }

    /**
     * @throws InvalidDelegationException if {@code code} is not a known type
     */
    public static DelegationType fromCode(int code) {
        if (code < 0 || code >= VALUES.length) {
            throw new InvalidDelegationException(
                    InvalidDelegationException.Reason.UNKNOWN_TYPE, "unknown delegation type code: " + code);
        }
        return VALUES[code];
    }

    /** Whether the delegation names a contract. */
    public boolean isContractScoped() {
        return this == CONTRACT || this == ERC721 || this == ERC20 || this == ERC1155;
    }

    /** Whether the delegation names a token id within its contract. */
    public boolean isTokenScoped() {
        return this == ERC721 || this == ERC1155;
    }

    /** Whether the delegation carries an amount. */
    public boolean carriesAmount() {
        return this == ERC20 || this == ERC1155;
    }
}
