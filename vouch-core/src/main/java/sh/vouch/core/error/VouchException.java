// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.error;

/**
 * Base runtime exception for all registry failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * VouchException
 * ├── {@link InvalidDelegationException} - rejected arguments (self-delegation, NONE type, malformed scope)
 * └── {@link UnauthorizedDelegationException} - caller is not the vault being mutated
 * </pre>
 *
 * <p>
 * Lookups that miss are not failures: {@code readRecord} returns a NONE sentinel
 * and authorization checks return {@code false}.
 *
 * <pre>{@code
 * try {
 *     delegator.delegateErc721(delegate, collection, tokenId, Rights.ALL, true);
 * } catch (UnauthorizedDelegationException e) {
 *     // caller does not own the vault
 * } catch (VouchException e) {
 *     // any other rejection
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class VouchException extends RuntimeException
        permits InvalidDelegationException,
        UnauthorizedDelegationException {

    public VouchException(final String message) {
        super(message);
    }

    public VouchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
