// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core;

import java.math.BigInteger;

import org.jspecify.annotations.Nullable;

import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * Formats one-line trace messages for {@link DebugLogger}.
 *
 * <p>
 * Every line starts with a bracketed tag, optionally preceded by a status
 * symbol (✓ authorized, ✗ denied or rejected, ○ revoked). Addresses and hashes
 * are shortened to {@code 0x1234...5678}; the all-rights tag prints as {@code *}.
 *
 * <pre>
 * [DELEGATE] type=ERC721 from=0x1111...1111 to=0x2222...2222 contract=0xc0c0...c0c0 tokenId=7 rights=* id=0x8f3e...0003
 * ○ [REVOKE] type=ALL from=0x1111...1111 to=0x2222...2222 rights=* id=0x51aa...0001
 * ✓ [CHECK] query=ERC721 to=0x2222...2222 from=0x1111...1111 rights=* level=CONTRACT
 * ✗ [REJECTED] op=setDelegation reason=SELF_DELEGATION
 * </pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened value, including "0x". */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened value. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [DELEGATE] or ○ [REVOKE], followed by the scope fields the type uses.
     */
    public static String formatDelegation(
            String type,
            Address from,
            Address to,
            Address contract,
            BigInteger tokenId,
            Rights rights,
            BigInteger amount,
            boolean enable,
            Hash identity) {
        final StringBuilder sb = new StringBuilder(enable ? "[DELEGATE]" : "○ [REVOKE]");
        sb.append(" type=").append(type)
                .append(" from=").append(shortenHash(from.value()))
                .append(" to=").append(shortenHash(to.value()));
        if (!contract.isZero()) {
            sb.append(" contract=").append(shortenHash(contract.value()));
        }
        if (tokenId.signum() != 0) {
            sb.append(" tokenId=").append(tokenId);
        }
        if (amount.signum() != 0) {
            sb.append(" amount=").append(amount);
        }
        sb.append(" rights=").append(formatRights(rights))
                .append(" id=").append(shortenHash(identity.value()));
        return sb.toString();
    }

    /**
     * Format: ✓ [CHECK] ... level=CONTRACT when authorized, ✗ [CHECK] ... when not.
     */
    public static String formatCheck(
            String query, Address to, Address from, Rights rights, @Nullable String matchedLevel) {
        final boolean authorized = matchedLevel != null;
        return String.format(
                "%s [CHECK] query=%s to=%s from=%s rights=%s%s",
                authorized ? "✓" : "✗",
                query,
                shortenHash(to.value()),
                shortenHash(from.value()),
                formatRights(rights),
                authorized ? " level=" + matchedLevel : "");
    }

    /**
     * Format: ✗ [REJECTED] op=setDelegation reason=SELF_DELEGATION
     */
    public static String formatRejection(String operation, String reason) {
        return String.format("✗ [REJECTED] op=%s reason=%s", operation, reason);
    }

    static String formatRights(Rights rights) {
        return rights.isAll() ? "*" : shortenHash(rights.value());
    }

    /**
     * Shortens long hex values to {@code 0x1234...5678}; short or null input is returned as-is.
     */
    public static @Nullable String shortenHash(@Nullable String hash) {
        if (hash == null || hash.length() <= HASH_SHORTEN_THRESHOLD) {
            return hash;
        }
        return hash.substring(0, HASH_PREFIX_LENGTH) + "..." + hash.substring(hash.length() - HASH_SUFFIX_LENGTH);
    }
}
