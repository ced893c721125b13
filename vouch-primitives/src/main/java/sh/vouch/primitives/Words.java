// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.primitives;

import java.math.BigInteger;

/**
 * Helpers for 32-byte big-endian words, the unit of {@code uint256} and {@code bytes32}.
 *
 * @since 0.1.0
 */
public final class Words {

    /** Size in bytes of one word. */
    public static final int WORD_SIZE = 32;

    /** {@code 2^256 - 1}, the largest {@code uint256}. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Words() {
        // Utility class
    }

    /**
     * Returns whether {@code value} fits in a {@code uint256}.
     */
    public static boolean isUint256(final BigInteger value) {
        return value != null && value.signum() >= 0 && value.bitLength() <= 256;
    }

    /**
     * Encodes a non-negative integer as a 32-byte big-endian word, left-padded with zeros.
     *
     * @param value the value to encode
     * @return a new 32-byte array
     * @throws IllegalArgumentException if the value is null or not a valid {@code uint256}
     */
    public static byte[] uint256(final BigInteger value) {
        if (!isUint256(value)) {
            throw new IllegalArgumentException("not a uint256: " + value);
        }
        final byte[] raw = value.toByteArray();
        final byte[] word = new byte[WORD_SIZE];
        // toByteArray() may carry a leading sign byte
        final int copy = Math.min(raw.length, WORD_SIZE);
        System.arraycopy(raw, raw.length - copy, word, WORD_SIZE - copy, copy);
        return word;
    }
}
