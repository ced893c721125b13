// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.benchmark;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;

import sh.vouch.core.delegation.DelegationHashes;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * JMH benchmark for delegation identity hashing.
 *
 * <p>The shortest (wallet-level, 72 bytes) and longest (token-level, 124 bytes)
 * preimages bound the cost of every identity lookup.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 3, time = 1)
@Fork(1)
public class IdentityHashBenchmark {

    private Address from;
    private Address to;
    private Address contract;
    private BigInteger tokenId;

    @Setup
    public void setup() {
        from = new Address("0x" + "11".repeat(20));
        to = new Address("0x" + "22".repeat(20));
        contract = new Address("0x" + "c0".repeat(20));
        tokenId = new BigInteger("123456789012345678901234567890");
    }

    @Benchmark
    public Hash allHash() {
        return DelegationHashes.allHash(from, Rights.ALL, to);
    }

    @Benchmark
    public Hash erc721Hash() {
        return DelegationHashes.erc721Hash(from, Rights.ALL, to, tokenId, contract);
    }
}
