// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core;

/**
 * Global toggle for verbose trace logging of registry activity.
 *
 * <p>Two independent channels: {@code store} traces every grant, revocation and
 * rejection; {@code resolver} traces every authorization check. Both start from
 * the system properties {@code vouch.debug} (both channels),
 * {@code vouch.debug.store} and {@code vouch.debug.resolver}, and can be flipped
 * at runtime.
 *
 * <p>Thread safety: fields are volatile. {@link #isEnabled()} reads them
 * non-atomically, which only affects best-effort logging.
 */
public final class VouchDebug {

    private static volatile boolean storeLogging =
            Boolean.getBoolean("vouch.debug") || Boolean.getBoolean("vouch.debug.store");
    private static volatile boolean resolverLogging =
            Boolean.getBoolean("vouch.debug") || Boolean.getBoolean("vouch.debug.resolver");

    private VouchDebug() {
    }

    /**
     * @return true if either channel is enabled
     */
    public static boolean isEnabled() {
        return storeLogging || resolverLogging;
    }

    public static void setEnabled(final boolean enabled) {
        storeLogging = enabled;
        resolverLogging = enabled;
    }

    public static void setStoreLogging(final boolean enabled) {
        storeLogging = enabled;
    }

    public static boolean isStoreLoggingEnabled() {
        return storeLogging;
    }

    public static void setResolverLogging(final boolean enabled) {
        resolverLogging = enabled;
    }

    public static boolean isResolverLoggingEnabled() {
        return resolverLogging;
    }
}
