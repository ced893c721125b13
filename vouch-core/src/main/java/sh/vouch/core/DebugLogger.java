// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized trace logger gated by {@link VouchDebug}.
 *
 * <p>All output goes to the SLF4J logger {@code sh.vouch.debug} at INFO, so it can
 * be routed or silenced independently of the per-class loggers.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.vouch.debug");

    private DebugLogger() {
    }

    public static void logStore(final String message, final Object... args) {
        if (!VouchDebug.isStoreLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logResolver(final String message, final Object... args) {
        if (!VouchDebug.isResolverLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!VouchDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(formatted);
    }
}
