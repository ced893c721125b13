// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.error;

import sh.vouch.core.types.Address;

/**
 * Thrown when an authenticated caller tries to mutate a vault it does not own.
 *
 * @since 0.1.0
 */
public final class UnauthorizedDelegationException extends VouchException {

    private final Address caller;
    private final Address vault;

    public UnauthorizedDelegationException(final Address caller, final Address vault) {
        super("caller " + caller.value() + " cannot modify delegations of vault " + vault.value());
        this.caller = caller;
        this.vault = vault;
    }

    public Address caller() {
        return caller;
    }

    public Address vault() {
        return vault;
    }
}
