// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.benchmark;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;

import sh.vouch.core.delegation.AuthorizationResolver;
import sh.vouch.core.delegation.Delegator;
import sh.vouch.core.delegation.InMemoryDelegationStore;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Rights;

/**
 * JMH benchmark for authorization checks against a populated registry.
 *
 * <p>Measures throughput (ops/sec) for:
 * <ul>
 *   <li>{@code tokenLevelHit} - match at the first level tried</li>
 *   <li>{@code walletLevelHit} - match only after token and contract levels miss</li>
 *   <li>{@code miss} - every level and both rights variants miss</li>
 *   <li>{@code erc20Amount} - amount resolution for a fungible grant</li>
 * </ul>
 *
 * <p>Each check costs up to six identity hashes, so the miss path is the worst case.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 3, time = 1)
@Fork(1)
public class AuthorizationBenchmark {

    private static final Address VAULT = new Address("0x" + "11".repeat(20));
    private static final Address WALLET_DELEGATE = new Address("0x" + "22".repeat(20));
    private static final Address TOKEN_DELEGATE = new Address("0x" + "33".repeat(20));
    private static final Address STRANGER = new Address("0x" + "44".repeat(20));
    private static final Address COLLECTION = new Address("0x" + "c0".repeat(20));
    private static final Address TOKEN = new Address("0x" + "e2".repeat(20));
    private static final Rights AIRDROP = Rights.ofLabel("airdrop");

    @Param({"100", "10000"})
    public int delegations;

    private AuthorizationResolver resolver;
    private BigInteger tokenId;

    @Setup
    public void setup() {
        InMemoryDelegationStore store = new InMemoryDelegationStore();
        Delegator vault = Delegator.bind(store, VAULT);
        for (int i = 0; i < delegations; i++) {
            vault.delegateErc721(TOKEN_DELEGATE, COLLECTION, BigInteger.valueOf(i), Rights.ALL, true);
        }
        vault.delegateAll(WALLET_DELEGATE, AIRDROP, true);
        vault.delegateErc20(TOKEN_DELEGATE, TOKEN, Rights.ALL, BigInteger.valueOf(1_000), true);
        resolver = new AuthorizationResolver(store);
        tokenId = BigInteger.valueOf(delegations / 2);
    }

    @Benchmark
    public boolean tokenLevelHit() {
        return resolver.check(TOKEN_DELEGATE, VAULT, COLLECTION, tokenId, Rights.ALL);
    }

    @Benchmark
    public boolean walletLevelHit() {
        return resolver.check(WALLET_DELEGATE, VAULT, COLLECTION, tokenId, AIRDROP);
    }

    @Benchmark
    public boolean miss() {
        return resolver.check(STRANGER, VAULT, COLLECTION, tokenId, AIRDROP);
    }

    @Benchmark
    public BigInteger erc20Amount() {
        return resolver.checkDelegateForErc20(TOKEN_DELEGATE, VAULT, TOKEN, Rights.ALL);
    }
}
