// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.vouch.core.DebugLogger;
import sh.vouch.core.LogFormatter;
import sh.vouch.core.error.UnauthorizedDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * Write access to a {@link DelegationStore} on behalf of one authenticated caller.
 *
 * <p>Whatever authenticates callers (a signature check, a session, a transaction sender)
 * binds the result here. Every mutation is then checked against that caller before it
 * reaches the store, and the per-type shortcuts always use it as the vault.
 *
 * <pre>{@code
 * Delegator vault = Delegator.bind(store, authenticatedSender);
 * vault.delegateErc721(hotWallet, collection, BigInteger.valueOf(7), Rights.ALL, true);
 * vault.delegateAll(hotWallet, Rights.ALL, false);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Delegator {

    private final DelegationStore store;
    private final Address caller;

    private Delegator(DelegationStore store, Address caller) {
        this.store = store;
        this.caller = caller;
    }

    public static Delegator bind(DelegationStore store, Address authenticatedCaller) {
        return new Delegator(
                Objects.requireNonNull(store, "store"),
                Objects.requireNonNull(authenticatedCaller, "authenticatedCaller"));
    }

    public Address caller() {
        return caller;
    }

    /**
     * @throws UnauthorizedDelegationException if {@code request.from()} is not the bound caller
     */
    public Hash setDelegation(DelegationRequest request) {
        requireOwner(request);
        return store.setDelegation(request);
    }

    /**
     * Batch form of {@link #setDelegation}. Ownership of every request is checked before
     * anything is written.
     */
    public List<Hash> setDelegations(List<DelegationRequest> requests) {
        for (DelegationRequest request : requests) {
            requireOwner(request);
        }
        return store.setDelegations(requests);
    }

    public Hash delegateAll(Address to, Rights rights, boolean enable) {
        return store.setDelegation(DelegationRequest.all(caller, to, rights, enable));
    }

    public Hash delegateContract(Address to, Address contract, Rights rights, boolean enable) {
        return store.setDelegation(DelegationRequest.contract(caller, to, contract, rights, enable));
    }

    public Hash delegateErc721(Address to, Address contract, BigInteger tokenId, Rights rights, boolean enable) {
        return store.setDelegation(DelegationRequest.erc721(caller, to, contract, tokenId, rights, enable));
    }

    public Hash delegateErc20(Address to, Address contract, Rights rights, BigInteger amount, boolean enable) {
        return store.setDelegation(DelegationRequest.erc20(caller, to, contract, rights, amount, enable));
    }

    public Hash delegateErc1155(
            Address to, Address contract, BigInteger tokenId, Rights rights, BigInteger amount, boolean enable) {
        return store.setDelegation(
                DelegationRequest.erc1155(caller, to, contract, tokenId, rights, amount, enable));
    }

    /**
     * @return the caller's currently enabled outgoing delegations
     */
    public List<DelegationRecord> outgoingDelegations() {
        return store.getOutgoingDelegations(caller);
    }

    private void requireOwner(DelegationRequest request) {
        Objects.requireNonNull(request, "request");
        if (!caller.equals(request.from())) {
            DebugLogger.logStore(LogFormatter.formatRejection("setDelegation", "UNAUTHORIZED"));
            throw new UnauthorizedDelegationException(caller, request.from());
        }
    }
}
