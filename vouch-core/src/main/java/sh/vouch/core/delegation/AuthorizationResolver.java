// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.vouch.core.DebugLogger;
import sh.vouch.core.LogFormatter;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;
import sh.vouch.primitives.Words;

/**
 * Answers "may {@code to} act for {@code from} on this asset under these rights?".
 *
 * <p>Each query walks a fixed priority list of granularity levels, most specific first
 * (token, then contract, then wallet). Any enabled match at any level authorizes: the
 * levels form a union, so revoking a wallet-level delegation leaves a token-level one in
 * force and vice versa.
 *
 * <p>At every level the requested rights are looked up as given and, if they are not
 * {@link Rights#ALL}, once more as {@link Rights#ALL}. A record tagged with rights
 * {@code R} therefore answers queries for {@code R} only, while an all-rights record
 * answers every query. A query for {@link Rights#ALL} is answered only by all-rights
 * records.
 *
 * <p>The resolver holds no state of its own and never throws for a miss. A token id that
 * is not a {@code uint256} matches nothing at token level; contract- and wallet-level
 * delegations still apply.
 *
 * <pre>{@code
 * AuthorizationResolver resolver = new AuthorizationResolver(store);
 * if (resolver.check(hotWallet, vault, collection, tokenId, Rights.ALL)) {
 *     // hotWallet may act for vault on this token
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AuthorizationResolver {

    private static final List<DelegationType> ALL_PATH = List.of(DelegationType.ALL);
    private static final List<DelegationType> CONTRACT_PATH = List.of(DelegationType.CONTRACT, DelegationType.ALL);
    private static final List<DelegationType> ERC721_PATH =
            List.of(DelegationType.ERC721, DelegationType.CONTRACT, DelegationType.ALL);
    private static final List<DelegationType> ERC20_PATH =
            List.of(DelegationType.ERC20, DelegationType.CONTRACT, DelegationType.ALL);
    private static final List<DelegationType> ERC1155_PATH =
            List.of(DelegationType.ERC1155, DelegationType.CONTRACT, DelegationType.ALL);

    private final DelegationStore store;

    public AuthorizationResolver(DelegationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Token-level authorization check for an ERC721 asset. Same as
     * {@link #checkDelegateForErc721}.
     */
    public boolean check(Address to, Address from, Address contract, BigInteger tokenId, Rights rights) {
        return checkDelegateForErc721(to, from, contract, tokenId, rights);
    }

    /**
     * Wallet-level delegations only.
     */
    public boolean checkDelegateForAll(Address to, Address from, Rights rights) {
        final Query query = new Query("ALL", to, from, Address.ZERO, BigInteger.ZERO, rights);
        return trace(query, firstMatch(ALL_PATH, query));
    }

    /**
     * Contract-level, then wallet-level delegations.
     */
    public boolean checkDelegateForContract(Address to, Address from, Address contract, Rights rights) {
        final Query query = new Query("CONTRACT", to, from, contract, BigInteger.ZERO, rights);
        return trace(query, firstMatch(CONTRACT_PATH, query));
    }

    public boolean checkDelegateForErc721(
            Address to, Address from, Address contract, BigInteger tokenId, Rights rights) {
        final Query query = new Query("ERC721", to, from, contract, tokenId, rights);
        return trace(query, firstMatch(ERC721_PATH, query));
    }

    /**
     * Amount of {@code contract}'s ERC20 balance that {@code to} may move for {@code from}.
     *
     * @return {@code 2^256 - 1} if a contract- or wallet-level delegation matches, else the
     *         largest amount among matching ERC20 delegations, else zero
     */
    public BigInteger checkDelegateForErc20(Address to, Address from, Address contract, Rights rights) {
        final Query query = new Query("ERC20", to, from, contract, BigInteger.ZERO, rights);
        return resolveAmount(ERC20_PATH, query);
    }

    /**
     * Amount of ERC1155 token {@code tokenId} that {@code to} may move for {@code from}.
     *
     * @return {@code 2^256 - 1} if a contract- or wallet-level delegation matches, else the
     *         largest amount among matching ERC1155 delegations, else zero
     */
    public BigInteger checkDelegateForErc1155(
            Address to, Address from, Address contract, BigInteger tokenId, Rights rights) {
        final Query query = new Query("ERC1155", to, from, contract, tokenId, rights);
        return resolveAmount(ERC1155_PATH, query);
    }

    private @Nullable DelegationType firstMatch(List<DelegationType> path, Query query) {
        for (DelegationType level : path) {
            if (lookup(level, query) != null) {
                return level;
            }
        }
        return null;
    }

    private BigInteger resolveAmount(List<DelegationType> path, Query query) {
        BigInteger best = BigInteger.ZERO;
        DelegationType matchedLevel = null;
        for (DelegationType level : path) {
            if (level.carriesAmount()) {
                best = best.max(maxAmount(level, query));
                if (best.signum() > 0) {
                    matchedLevel = level;
                }
            } else if (lookup(level, query) != null) {
                trace(query, level);
                return Words.MAX_UINT256;
            }
        }
        trace(query, matchedLevel);
        return best;
    }

    /**
     * Returns a matching record at {@code level}, trying the requested rights and then all rights.
     */
    private @Nullable DelegationRecord lookup(DelegationType level, Query query) {
        final DelegationRecord exact = read(level, query, query.rights());
        if (exact.authorizes(query.rights())) {
            return exact;
        }
        if (query.rights().isAll()) {
            return null;
        }
        final DelegationRecord universal = read(level, query, Rights.ALL);
        return universal.authorizes(query.rights()) ? universal : null;
    }

    private BigInteger maxAmount(DelegationType level, Query query) {
        BigInteger best = BigInteger.ZERO;
        final DelegationRecord exact = read(level, query, query.rights());
        if (exact.authorizes(query.rights())) {
            best = exact.amount();
        }
        if (!query.rights().isAll()) {
            final DelegationRecord universal = read(level, query, Rights.ALL);
            if (universal.authorizes(query.rights())) {
                best = best.max(universal.amount());
            }
        }
        return best;
    }

    private DelegationRecord read(DelegationType level, Query query, Rights rights) {
        if (level.isTokenScoped() && !Words.isUint256(query.tokenId())) {
            return DelegationRecord.none();
        }
        final Address contract = level.isContractScoped() ? query.contract() : Address.ZERO;
        final BigInteger tokenId = level.isTokenScoped() ? query.tokenId() : BigInteger.ZERO;
        final Hash identity = DelegationHashes.compute(level, query.from(), query.to(), contract, tokenId, rights);
        return store.readRecord(identity);
    }

    private static boolean trace(Query query, @Nullable DelegationType matchedLevel) {
        DebugLogger.logResolver(LogFormatter.formatCheck(
                query.kind(), query.to(), query.from(), query.rights(),
                matchedLevel == null ? null : matchedLevel.name()));
        return matchedLevel != null;
    }

    private record Query(String kind, Address to, Address from, Address contract, BigInteger tokenId, Rights rights) {
        Query {
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(contract, "contract");
            Objects.requireNonNull(tokenId, "tokenId");
            Objects.requireNonNull(rights, "rights");
        }
    }
}
