// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

/**
 * Receives a {@link DelegationChanged} after each mutation has been applied.
 *
 * <p>Called on the mutating thread, in mutation order. A listener that throws is
 * logged and skipped; the mutation stands.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DelegationListener {

    void onDelegationChanged(DelegationChanged event);
}
