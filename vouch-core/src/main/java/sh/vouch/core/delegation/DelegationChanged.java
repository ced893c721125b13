// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;

import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * Logical event emitted for every applied {@code setDelegation} call, grant or revoke.
 *
 * <p>Carries the arguments as stored (after normalization) plus the identity they hash to.
 * Recording or broadcasting it is up to the {@link DelegationListener}.
 *
 * @param identity the slot that was written
 * @param type     delegation granularity
 * @param from     vault
 * @param to       delegate
 * @param contract target contract, zero for wallet-level delegations
 * @param tokenId  token id, zero where unused
 * @param rights   rights tag
 * @param amount   amount, zero where unused
 * @param enable   {@code true} for a grant, {@code false} for a revocation
 * @since 0.1.0
 */
public record DelegationChanged(
        Hash identity,
        DelegationType type,
        Address from,
        Address to,
        Address contract,
        BigInteger tokenId,
        Rights rights,
        BigInteger amount,
        boolean enable) {

    static DelegationChanged of(Hash identity, DelegationRequest request) {
        return new DelegationChanged(
                identity,
                request.type(),
                request.from(),
                request.to(),
                request.contract(),
                request.tokenId(),
                request.rights(),
                request.amount(),
                request.enable());
    }
}
