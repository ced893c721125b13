// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;

import sh.vouch.core.delegation.DelegationStoreConfig.ScopeValidation;
import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.error.InvalidDelegationException.Reason;
import sh.vouch.core.types.Address;
import sh.vouch.primitives.Words;

/**
 * Argument checks shared by every mutating entry point. Runs before any state is touched.
 */
final class DelegationValidator {

    private DelegationValidator() {
    }

    /**
     * @return the request to store, with ignored fields zeroed under {@link ScopeValidation#NORMALIZE}
     * @throws InvalidDelegationException if the request cannot be stored
     */
    static DelegationRequest validate(DelegationRequest request, ScopeValidation mode) {
        final DelegationType type = request.type();
        if (type == DelegationType.NONE) {
            throw new InvalidDelegationException(Reason.NONE_TYPE, "NONE is not a storable delegation type");
        }
        if (request.from().equals(request.to())) {
            throw new InvalidDelegationException(
                    Reason.SELF_DELEGATION, "vault cannot delegate to itself: " + request.from().value());
        }
        if (type.isContractScoped() && request.contract().isZero()) {
            throw new InvalidDelegationException(Reason.MALFORMED_SCOPE, type + " delegation requires a contract");
        }

        final Address contract = type.isContractScoped()
                ? request.contract()
                : ignored(request.contract(), Address.ZERO, "contract", type, mode);
        final BigInteger tokenId = type.isTokenScoped()
                ? uint256(request.tokenId(), "tokenId")
                : ignored(request.tokenId(), BigInteger.ZERO, "tokenId", type, mode);
        final BigInteger amount = type.carriesAmount()
                ? uint256(request.amount(), "amount")
                : ignored(request.amount(), BigInteger.ZERO, "amount", type, mode);

        if (contract.equals(request.contract())
                && tokenId.equals(request.tokenId())
                && amount.equals(request.amount())) {
            return request;
        }
        return new DelegationRequest(
                type, request.from(), request.to(), contract, tokenId, request.rights(), amount, request.enable());
    }

    private static <T> T ignored(T value, T zero, String field, DelegationType type, ScopeValidation mode) {
        if (value.equals(zero)) {
            return value;
        }
        if (mode == ScopeValidation.NORMALIZE) {
            return zero;
        }
        throw new InvalidDelegationException(
                Reason.MALFORMED_SCOPE, type + " delegation does not take a " + field + ", got " + value);
    }

    private static BigInteger uint256(BigInteger value, String field) {
        if (!Words.isUint256(value)) {
            throw new InvalidDelegationException(Reason.OUT_OF_RANGE, field + " is not a uint256: " + value);
        }
        return value;
    }
}
