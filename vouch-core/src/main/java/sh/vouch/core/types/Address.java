// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.vouch.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Used for vaults, delegates and the contracts a delegation is scoped to.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so checksummed and lowercase spellings of
 * the same address are equal.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address. Stands in for "no contract" on wallet-level delegations.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * @return a new 20-byte array
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
