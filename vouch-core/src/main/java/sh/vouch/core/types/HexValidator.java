// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for {@code 0x}-prefixed hex strings of an exact byte length.
 * <p>
 * Shared by {@link Address}, {@link Hash} and {@link Rights} so all three
 * validate the same way.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a pattern that matches {@code 0x} followed by exactly
     * {@code byteLength * 2} hex characters, in either case.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return the compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
