// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.vouch.primitives.Hex;
import sh.vouch.primitives.Words;

/**
 * Opaque 32-byte rights tag attached to a delegation.
 * <p>
 * The zero tag ({@link #ALL}) means "all rights". Any other value narrows a
 * delegation to one named sub-right; the registry never interprets the bytes,
 * it only compares them for equality.
 * <p>
 * A record tagged {@code R} satisfies a query for {@code R}; a record tagged
 * {@link #ALL} satisfies every query. See {@link #satisfies(Rights)}.
 *
 * <pre>{@code
 * Rights airdrops = Rights.ofLabel("airdrop");   // bytes32("airdrop")
 * Rights exact = Rights.fromHex("0x" + "ab".repeat(32));
 * }</pre>
 *
 * @since 0.1.0
 */
public record Rights(@JsonValue String value) {
    private static final Pattern HEX = HexValidator.fixedLength(Words.WORD_SIZE);

    /** The unrestricted tag. */
    public static final Rights ALL = new Rights("0x" + "0".repeat(Words.WORD_SIZE * 2));

    public Rights {
        Objects.requireNonNull(value, "rights");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid rights: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Rights fromHex(final String hex) {
        return new Rights(hex);
    }

    public static Rights fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != Words.WORD_SIZE) {
            throw new IllegalArgumentException("Rights must be exactly " + Words.WORD_SIZE + " bytes");
        }
        return new Rights(Hex.encode(bytes));
    }

    /**
     * Encodes a short label the way Solidity converts a string literal to {@code bytes32}:
     * UTF-8 bytes, left-aligned, zero-padded on the right.
     *
     * @throws IllegalArgumentException if the label is empty or longer than 32 bytes
     */
    public static Rights ofLabel(final String label) {
        Objects.requireNonNull(label, "label");
        final byte[] utf8 = label.getBytes(StandardCharsets.UTF_8);
        if (utf8.length == 0 || utf8.length > Words.WORD_SIZE) {
            throw new IllegalArgumentException("label must be 1-32 bytes, got " + utf8.length);
        }
        final byte[] word = new byte[Words.WORD_SIZE];
        System.arraycopy(utf8, 0, word, 0, utf8.length);
        return new Rights(Hex.encode(word));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * @return {@code true} for the zero tag
     */
    public boolean isAll() {
        return ALL.value.equals(value);
    }

    /**
     * Whether a record carrying these rights answers a query for {@code requested}.
     * <p>
     * True iff this tag is zero or equals {@code requested}. A zero query is only
     * satisfied by a zero tag.
     */
    public boolean satisfies(final Rights requested) {
        Objects.requireNonNull(requested, "requested");
        return isAll() || value.equals(requested.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
