// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.Objects;

import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * One granted (or previously granted, now revoked) delegation.
 *
 * <p>A single tagged record covers every granularity; {@link #type()} says which
 * of {@code contract} and {@code tokenId} are meaningful. Fields a type does not
 * use are zero. A record with {@code enabled == false} is logically absent but
 * keeps its slot, so the same identity can be re-enabled later.
 *
 * @param type     granularity; {@link DelegationType#NONE} only for {@link #none()}
 * @param from     the vault granting authority
 * @param to       the delegate receiving authority
 * @param contract target contract, {@link Address#ZERO} for wallet-level records
 * @param tokenId  token id for ERC721/ERC1155 records, zero otherwise
 * @param rights   rights tag, {@link Rights#ALL} for unrestricted
 * @param amount   quantity for ERC20/ERC1155 records, zero otherwise
 * @param enabled  whether the delegation is currently in force
 * @since 0.1.0
 */
public record DelegationRecord(
        DelegationType type,
        Address from,
        Address to,
        Address contract,
        BigInteger tokenId,
        Rights rights,
        BigInteger amount,
        boolean enabled) {

    private static final DelegationRecord NONE = new DelegationRecord(
            DelegationType.NONE, Address.ZERO, Address.ZERO, Address.ZERO,
            BigInteger.ZERO, Rights.ALL, BigInteger.ZERO, false);

    public DelegationRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(rights, "rights");
        Objects.requireNonNull(amount, "amount");
    }

    /**
     * The sentinel returned for identities that were never written.
     */
    public static DelegationRecord none() {
        return NONE;
    }

    public boolean isNone() {
        return type == DelegationType.NONE;
    }

    /**
     * Whether this record authorizes a query for {@code requested} rights: it must be
     * enabled and its own rights must be {@link Rights#ALL} or equal to the request.
     */
    public boolean authorizes(Rights requested) {
        return enabled && rights.satisfies(requested);
    }

    /**
     * @throws IllegalStateException for the NONE sentinel, which has no identity
     */
    public Hash identity() {
        if (isNone()) {
            throw new IllegalStateException("NONE record has no identity");
        }
        return DelegationHashes.compute(type, from, to, contract, tokenId, rights);
    }

    DelegationRecord withEnabled(boolean value) {
        return value == enabled
                ? this
                : new DelegationRecord(type, from, to, contract, tokenId, rights, amount, value);
    }
}
