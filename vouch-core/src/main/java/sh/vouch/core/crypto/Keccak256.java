// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 hashing (the pre-standard SHA-3 variant used by EVM chains).
 *
 * <p>
 * Wraps BouncyCastle's {@code Keccak.Digest256}. Digest instances are cached per
 * thread; call {@link #cleanup()} from pooled threads that are being handed back
 * to a container.
 *
 * <pre>{@code
 * byte[] digest = Keccak256.hash(rights.toBytes(), from.toBytes(), to.toBytes());
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * @param input the data to hash
     * @return 32-byte digest
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Hashes the concatenation of {@code inputs} without building the packed array.
     *
     * @param inputs the segments, in order
     * @return 32-byte digest
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Removes the cached digest instance from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
