// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.Objects;

import sh.vouch.core.crypto.Keccak256;
import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;
import sh.vouch.primitives.Words;

/**
 * Delegation identity scheme.
 *
 * <p>An identity is the Keccak-256 of the tightly packed scope fields, shifted left
 * by one byte, with the {@link DelegationType#code() type code} in the low byte:
 *
 * <pre>
 * ALL       keccak256(rights ‖ from ‖ to)
 * CONTRACT  keccak256(rights ‖ from ‖ to ‖ contract)
 * ERC721    keccak256(rights ‖ from ‖ to ‖ tokenId ‖ contract)
 * ERC20     keccak256(rights ‖ from ‖ to ‖ contract)
 * ERC1155   keccak256(rights ‖ from ‖ to ‖ tokenId ‖ contract)
 *
 * identity = (uint256(digest) &lt;&lt; 8) | code
 * </pre>
 *
 * <p>Rights and token ids are 32-byte words, addresses 20 bytes. The layout matches
 * the on-chain delegate registry, so identities computed here can be compared with
 * ones read from a chain. {@code enabled} and {@code amount} are not part of the
 * identity.
 *
 * @since 0.1.0
 */
public final class DelegationHashes {

    private DelegationHashes() {
    }

    public static Hash allHash(Address from, Rights rights, Address to) {
        return withType(Keccak256.hash(rights.toBytes(), from.toBytes(), to.toBytes()), DelegationType.ALL);
    }

    public static Hash contractHash(Address from, Rights rights, Address to, Address contract) {
        return withType(
                Keccak256.hash(rights.toBytes(), from.toBytes(), to.toBytes(), contract.toBytes()),
                DelegationType.CONTRACT);
    }

    public static Hash erc721Hash(Address from, Rights rights, Address to, BigInteger tokenId, Address contract) {
        return withType(tokenDigest(from, rights, to, tokenId, contract), DelegationType.ERC721);
    }

    public static Hash erc20Hash(Address from, Rights rights, Address to, Address contract) {
        return withType(
                Keccak256.hash(rights.toBytes(), from.toBytes(), to.toBytes(), contract.toBytes()),
                DelegationType.ERC20);
    }

    public static Hash erc1155Hash(Address from, Rights rights, Address to, BigInteger tokenId, Address contract) {
        return withType(tokenDigest(from, rights, to, tokenId, contract), DelegationType.ERC1155);
    }

    /**
     * Computes the identity for any storable type. Fields the type does not hash are ignored.
     *
     * @throws InvalidDelegationException for {@link DelegationType#NONE}
     */
    public static Hash compute(
            DelegationType type, Address from, Address to, Address contract, BigInteger tokenId, Rights rights) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case ALL -> allHash(from, rights, to);
            case CONTRACT -> contractHash(from, rights, to, contract);
            case ERC721 -> erc721Hash(from, rights, to, tokenId, contract);
            case ERC20 -> erc20Hash(from, rights, to, contract);
            case ERC1155 -> erc1155Hash(from, rights, to, tokenId, contract);
            case NONE -> throw new InvalidDelegationException(
                    InvalidDelegationException.Reason.NONE_TYPE, "NONE delegations have no identity");
        };
    }

    /**
     * Reads the type code from the low byte of an identity.
     *
     * @throws InvalidDelegationException if the low byte is not a known type code
     */
    public static DelegationType decodeType(Hash identity) {
        final byte[] bytes = identity.toBytes();
        return DelegationType.fromCode(bytes[bytes.length - 1] & 0xFF);
    }

    private static byte[] tokenDigest(Address from, Rights rights, Address to, BigInteger tokenId, Address contract) {
        return Keccak256.hash(
                rights.toBytes(), from.toBytes(), to.toBytes(), Words.uint256(tokenId), contract.toBytes());
    }

    private static Hash withType(byte[] digest, DelegationType type) {
        // shl(8) drops the top byte
        final byte[] out = new byte[Hash.BYTE_LENGTH];
        System.arraycopy(digest, 1, out, 0, Hash.BYTE_LENGTH - 1);
        out[Hash.BYTE_LENGTH - 1] = (byte) type.code();
        return Hash.fromBytes(out);
    }
}
