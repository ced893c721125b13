// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * Authoritative, idempotent storage of delegation state.
 *
 * <p>Records are keyed by their {@linkplain DelegationHashes identity}. Granting the same
 * scope twice overwrites the same slot; revoking flips {@code enabled} off and keeps the
 * slot. Records are never physically removed.
 *
 * <p>The store trusts that {@code from} is the authenticated caller. Wrap it in a
 * {@link Delegator} where that has to be enforced.
 *
 * <p>Implementations must make each mutation atomic and serializable with respect to other
 * mutations; reads never mutate and may run concurrently.
 *
 * @since 0.1.0
 */
public interface DelegationStore {

    /**
     * Grants ({@code enable = true}) or revokes ({@code enable = false}) one delegation.
     *
     * @return the identity of the written slot
     * @throws InvalidDelegationException if the arguments are rejected; nothing is written
     */
    Hash setDelegation(
            DelegationType type,
            Address from,
            Address to,
            Address contract,
            BigInteger tokenId,
            Rights rights,
            BigInteger amount,
            boolean enable);

    default Hash setDelegation(DelegationRequest request) {
        return setDelegation(
                request.type(),
                request.from(),
                request.to(),
                request.contract(),
                request.tokenId(),
                request.rights(),
                request.amount(),
                request.enable());
    }

    /**
     * Applies several requests as one unit: all are validated first, and if any is rejected
     * nothing is written.
     *
     * @return identities, in request order
     * @throws InvalidDelegationException if any request is rejected
     */
    List<Hash> setDelegations(List<DelegationRequest> requests);

    /**
     * @return the stored record, enabled or not, or {@link DelegationRecord#none()} if the
     *         identity was never written
     */
    DelegationRecord readRecord(Hash identity);

    /**
     * Batch {@link #readRecord}; the result lines up with {@code identities}.
     */
    default List<DelegationRecord> getDelegationsFromHashes(List<Hash> identities) {
        final List<DelegationRecord> out = new ArrayList<>(identities.size());
        for (Hash identity : identities) {
            out.add(readRecord(identity));
        }
        return out;
    }

    /**
     * @return every enabled record whose vault is {@code from}, in no particular order
     */
    List<DelegationRecord> getOutgoingDelegations(Address from);

    /**
     * @return every enabled record whose delegate is {@code to}, in no particular order
     */
    List<DelegationRecord> getIncomingDelegations(Address to);

    List<Hash> getOutgoingDelegationHashes(Address from);

    List<Hash> getIncomingDelegationHashes(Address to);

    void addListener(DelegationListener listener);

    void removeListener(DelegationListener listener);
}
