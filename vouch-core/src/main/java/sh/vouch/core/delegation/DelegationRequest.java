// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.Objects;

import sh.vouch.core.types.Address;
import sh.vouch.core.types.Rights;

/**
 * Arguments of one {@code setDelegation} call.
 *
 * <p>The per-type factories fill the fields a type ignores with zeros:
 *
 * <pre>{@code
 * DelegationRequest grant = DelegationRequest.erc721(vault, hotWallet, collection, BigInteger.valueOf(7), Rights.ALL, true);
 * DelegationRequest revoke = DelegationRequest.all(vault, hotWallet, Rights.ALL, false);
 * }</pre>
 *
 * <p>Only null checks happen here; semantic validation (self-delegation, scope
 * shape, ranges) is done by the store so that every entry point shares it.
 *
 * @since 0.1.0
 */
public record DelegationRequest(
        DelegationType type,
        Address from,
        Address to,
        Address contract,
        BigInteger tokenId,
        Rights rights,
        BigInteger amount,
        boolean enable) {

    public DelegationRequest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(rights, "rights");
        Objects.requireNonNull(amount, "amount");
    }

    public static DelegationRequest all(Address from, Address to, Rights rights, boolean enable) {
        return new DelegationRequest(
                DelegationType.ALL, from, to, Address.ZERO, BigInteger.ZERO, rights, BigInteger.ZERO, enable);
    }

    public static DelegationRequest contract(
            Address from, Address to, Address contract, Rights rights, boolean enable) {
        return new DelegationRequest(
                DelegationType.CONTRACT, from, to, contract, BigInteger.ZERO, rights, BigInteger.ZERO, enable);
    }

    public static DelegationRequest erc721(
            Address from, Address to, Address contract, BigInteger tokenId, Rights rights, boolean enable) {
        return new DelegationRequest(
                DelegationType.ERC721, from, to, contract, tokenId, rights, BigInteger.ZERO, enable);
    }

    public static DelegationRequest erc20(
            Address from, Address to, Address contract, Rights rights, BigInteger amount, boolean enable) {
        return new DelegationRequest(
                DelegationType.ERC20, from, to, contract, BigInteger.ZERO, rights, amount, enable);
    }

    public static DelegationRequest erc1155(
            Address from, Address to, Address contract, BigInteger tokenId, Rights rights, BigInteger amount,
            boolean enable) {
        return new DelegationRequest(
                DelegationType.ERC1155, from, to, contract, tokenId, rights, amount, enable);
    }

    DelegationRecord toRecord(boolean enabled) {
        return new DelegationRecord(type, from, to, contract, tokenId, rights, amount, enabled);
    }
}
