// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.vouch.core.delegation.DelegationStoreConfig.ScopeValidation;
import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

class InMemoryDelegationStoreTest {

    private static final Address VAULT = new Address("0x" + "11".repeat(20));
    private static final Address DELEGATE = new Address("0x" + "22".repeat(20));
    private static final Address OTHER_DELEGATE = new Address("0x" + "33".repeat(20));
    private static final Address COLLECTION = new Address("0x" + "c0".repeat(20));
    private static final Address TOKEN_CONTRACT = new Address("0x" + "e2".repeat(20));
    private static final BigInteger TOKEN = BigInteger.valueOf(7);
    private static final Rights AIRDROP = Rights.ofLabel("airdrop");

    private InMemoryDelegationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDelegationStore();
    }

    // ==================== setDelegation ====================

    @Test
    void grantReturnsIdentityAndStoresEnabledRecord() {
        Hash id = store.setDelegation(DelegationRequest.erc721(VAULT, DELEGATE, COLLECTION, TOKEN, Rights.ALL, true));

        assertEquals(DelegationHashes.erc721Hash(VAULT, Rights.ALL, DELEGATE, TOKEN, COLLECTION), id);
        DelegationRecord record = store.readRecord(id);
        assertEquals(DelegationType.ERC721, record.type());
        assertEquals(VAULT, record.from());
        assertEquals(DELEGATE, record.to());
        assertEquals(COLLECTION, record.contract());
        assertEquals(TOKEN, record.tokenId());
        assertTrue(record.enabled());
        assertEquals(id, record.identity());
    }

    @Test
    void grantIsIdempotent() {
        DelegationRequest request = DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true);

        Hash first = store.setDelegation(request);
        DelegationRecord afterFirst = store.readRecord(first);
        Hash second = store.setDelegation(request);

        assertEquals(first, second);
        assertEquals(afterFirst, store.readRecord(second));
        assertEquals(1, store.getOutgoingDelegations(VAULT).size());
    }

    @Test
    void regrantWithNewAmountReusesSlot() {
        Hash first = store.setDelegation(
                DelegationRequest.erc20(VAULT, DELEGATE, TOKEN_CONTRACT, Rights.ALL, BigInteger.valueOf(100), true));
        Hash second = store.setDelegation(
                DelegationRequest.erc20(VAULT, DELEGATE, TOKEN_CONTRACT, Rights.ALL, BigInteger.valueOf(250), true));

        assertEquals(first, second);
        assertEquals(BigInteger.valueOf(250), store.readRecord(first).amount());
        assertEquals(1, store.getOutgoingDelegations(VAULT).size());
    }

    @Test
    void revokeDisablesButKeepsRecord() {
        Hash id = store.setDelegation(
                DelegationRequest.erc1155(VAULT, DELEGATE, COLLECTION, TOKEN, Rights.ALL, BigInteger.TEN, true));

        Hash revoked = store.setDelegation(
                DelegationRequest.erc1155(VAULT, DELEGATE, COLLECTION, TOKEN, Rights.ALL, BigInteger.ONE, false));

        assertEquals(id, revoked);
        DelegationRecord record = store.readRecord(id);
        assertFalse(record.enabled());
        assertFalse(record.isNone());
        assertEquals(BigInteger.TEN, record.amount(), "revocation keeps the last granted amount");
        assertTrue(store.getOutgoingDelegations(VAULT).isEmpty());
        assertTrue(store.getIncomingDelegations(DELEGATE).isEmpty());
    }

    @Test
    void revokeWithoutGrantCreatesDisabledPlaceholder() {
        Hash id = store.setDelegation(DelegationRequest.contract(VAULT, DELEGATE, COLLECTION, Rights.ALL, false));

        DelegationRecord record = store.readRecord(id);
        assertEquals(DelegationType.CONTRACT, record.type());
        assertFalse(record.enabled());
        assertTrue(store.getOutgoingDelegations(VAULT).isEmpty());
    }

    @Test
    void reenableAfterRevoke() {
        DelegationRequest grant = DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true);
        DelegationRequest revoke = DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, false);

        Hash id = store.setDelegation(grant);
        store.setDelegation(revoke);
        store.setDelegation(grant);

        assertTrue(store.readRecord(id).enabled());
        assertEquals(List.of(id), store.getOutgoingDelegationHashes(VAULT));
    }

    @Test
    void zeroAndNarrowRightsAreIndependentRecords() {
        Hash all = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        Hash narrow = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, AIRDROP, true));

        assertNotEquals(all, narrow);
        store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, false));

        assertFalse(store.readRecord(all).enabled());
        assertTrue(store.readRecord(narrow).enabled());
    }

    @Test
    void selfDelegationRejectedWithoutStateChange() {
        InvalidDelegationException e = assertThrows(InvalidDelegationException.class,
                () -> store.setDelegation(DelegationRequest.all(VAULT, VAULT, Rights.ALL, true)));

        assertEquals(InvalidDelegationException.Reason.SELF_DELEGATION, e.reason());
        assertTrue(store.getOutgoingDelegations(VAULT).isEmpty());
        assertTrue(store.readRecord(DelegationHashes.allHash(VAULT, Rights.ALL, VAULT)).isNone());
    }

    @Test
    void noneTypeRejected() {
        assertThrows(InvalidDelegationException.class, () -> store.setDelegation(
                DelegationType.NONE, VAULT, DELEGATE, Address.ZERO, BigInteger.ZERO, Rights.ALL, BigInteger.ZERO,
                true));
    }

    @Test
    void strictModeRejectsTokenIdOnWalletDelegation() {
        assertThrows(InvalidDelegationException.class, () -> store.setDelegation(
                DelegationType.ALL, VAULT, DELEGATE, Address.ZERO, TOKEN, Rights.ALL, BigInteger.ZERO, true));
        assertTrue(store.getOutgoingDelegations(VAULT).isEmpty());
    }

    @Test
    void normalizeModeStoresCleanedRecord() {
        InMemoryDelegationStore lenient = new InMemoryDelegationStore(
                DelegationStoreConfig.builder().scopeValidation(ScopeValidation.NORMALIZE).build());

        Hash id = lenient.setDelegation(
                DelegationType.ALL, VAULT, DELEGATE, COLLECTION, TOKEN, Rights.ALL, BigInteger.TEN, true);

        assertEquals(DelegationHashes.allHash(VAULT, Rights.ALL, DELEGATE), id);
        DelegationRecord record = lenient.readRecord(id);
        assertEquals(Address.ZERO, record.contract());
        assertEquals(BigInteger.ZERO, record.tokenId());
        assertEquals(BigInteger.ZERO, record.amount());
    }

    @Test
    void nullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> store.setDelegation(
                DelegationType.ALL, null, DELEGATE, Address.ZERO, BigInteger.ZERO, Rights.ALL, BigInteger.ZERO, true));
        assertThrows(NullPointerException.class, () -> store.readRecord(null));
    }

    // ==================== setDelegations ====================

    @Test
    void batchAppliesAllInOrder() {
        List<Hash> ids = store.setDelegations(List.of(
                DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true),
                DelegationRequest.contract(VAULT, OTHER_DELEGATE, COLLECTION, AIRDROP, true),
                DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, false)));

        assertEquals(3, ids.size());
        assertEquals(ids.get(0), ids.get(2));
        assertFalse(store.readRecord(ids.get(0)).enabled());
        assertTrue(store.readRecord(ids.get(1)).enabled());
        assertEquals(List.of(ids.get(1)), store.getOutgoingDelegationHashes(VAULT));
    }

    @Test
    void batchWithInvalidEntryWritesNothing() {
        assertThrows(InvalidDelegationException.class, () -> store.setDelegations(List.of(
                DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true),
                DelegationRequest.erc721(VAULT, VAULT, COLLECTION, TOKEN, Rights.ALL, true))));

        assertTrue(store.getOutgoingDelegations(VAULT).isEmpty());
        assertTrue(store.readRecord(DelegationHashes.allHash(VAULT, Rights.ALL, DELEGATE)).isNone());
    }

    // ==================== reads ====================

    @Test
    void readUnknownIdentityReturnsNoneSentinel() {
        DelegationRecord record = store.readRecord(new Hash("0x" + "ab".repeat(32)));

        assertTrue(record.isNone());
        assertEquals(DelegationType.NONE, record.type());
        assertFalse(record.enabled());
        assertSame(DelegationRecord.none(), record);
    }

    @Test
    void outgoingEnumerationTracksLatestState() {
        Hash wallet = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        Hash contract = store.setDelegation(DelegationRequest.contract(VAULT, DELEGATE, COLLECTION, AIRDROP, true));
        Hash token = store.setDelegation(
                DelegationRequest.erc721(VAULT, OTHER_DELEGATE, COLLECTION, TOKEN, Rights.ALL, true));
        store.setDelegation(DelegationRequest.contract(VAULT, DELEGATE, COLLECTION, AIRDROP, false));

        assertEquals(Set.of(wallet, token), Set.copyOf(store.getOutgoingDelegationHashes(VAULT)));
        assertEquals(Set.of(wallet, token),
                Set.copyOf(store.getOutgoingDelegations(VAULT).stream().map(DelegationRecord::identity).toList()));
        assertFalse(store.readRecord(contract).enabled());
        assertTrue(store.getOutgoingDelegations(DELEGATE).isEmpty());
    }

    @Test
    void incomingEnumerationIsKeyedByDelegate() {
        Address secondVault = new Address("0x" + "44".repeat(20));
        Hash fromVault = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        Hash fromSecond = store.setDelegation(DelegationRequest.all(secondVault, DELEGATE, AIRDROP, true));
        store.setDelegation(DelegationRequest.all(VAULT, OTHER_DELEGATE, Rights.ALL, true));

        assertEquals(Set.of(fromVault, fromSecond), Set.copyOf(store.getIncomingDelegationHashes(DELEGATE)));
        assertEquals(2, store.getIncomingDelegations(DELEGATE).size());
        assertTrue(store.getIncomingDelegations(VAULT).isEmpty());
    }

    @Test
    void delegationsFromHashesAreAligned() {
        Hash known = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        Hash unknown = new Hash("0x" + "cd".repeat(32));

        List<DelegationRecord> records = store.getDelegationsFromHashes(List.of(unknown, known));

        assertTrue(records.get(0).isNone());
        assertEquals(DELEGATE, records.get(1).to());
    }

    @Test
    void enumerationResultsAreImmutableSnapshots() {
        store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        List<DelegationRecord> snapshot = store.getOutgoingDelegations(VAULT);

        store.setDelegation(DelegationRequest.all(VAULT, OTHER_DELEGATE, Rights.ALL, true));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, snapshot::clear);
    }

    // ==================== concurrency ====================

    @Test
    void concurrentWritersAndReadersLeaveConsistentState() throws Exception {
        int threadCount = 8;
        int perThread = 250;
        AuthorizationResolver resolver = new AuthorizationResolver(store);
        Hash shared = store.setDelegation(DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true));
        Hash sharedRevoked = store.setDelegation(DelegationRequest.all(VAULT, OTHER_DELEGATE, AIRDROP, true));

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            final int thread = t;
            futures.add(executor.submit(() -> {
                startLatch.await();
                int missedChecks = 0;
                for (int i = 0; i < perThread; i++) {
                    Address delegate = delegateFor(thread, i);
                    store.setDelegation(DelegationRequest.all(VAULT, delegate, Rights.ALL, true));
                    if (i % 2 == 1) {
                        store.setDelegation(DelegationRequest.all(VAULT, delegate, Rights.ALL, false));
                    }
                    store.setDelegations(List.of(
                            DelegationRequest.all(VAULT, DELEGATE, Rights.ALL, true),
                            DelegationRequest.all(VAULT, OTHER_DELEGATE, AIRDROP, false)));
                    if (!resolver.check(DELEGATE, VAULT, COLLECTION, TOKEN, AIRDROP)) {
                        missedChecks++;
                    }
                }
                return missedChecks;
            }));
        }

        startLatch.countDown();
        for (Future<Integer> future : futures) {
            assertEquals(0, future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(store.readRecord(shared).enabled());
        assertFalse(store.readRecord(sharedRevoked).enabled());
        for (int t = 0; t < threadCount; t++) {
            for (int i = 0; i < perThread; i++) {
                Hash id = DelegationHashes.allHash(VAULT, Rights.ALL, delegateFor(t, i));
                assertEquals(i % 2 == 0, store.readRecord(id).enabled(), "thread " + t + " delegate " + i);
            }
        }

        Set<Hash> enumerated = new HashSet<>(store.getOutgoingDelegationHashes(VAULT));
        assertEquals(threadCount * perThread / 2 + 1, enumerated.size());
        assertTrue(enumerated.contains(shared));
        assertFalse(enumerated.contains(sharedRevoked));
        for (DelegationRecord record : store.getOutgoingDelegations(VAULT)) {
            assertTrue(record.enabled());
            assertTrue(enumerated.contains(record.identity()));
        }
        assertEquals(enumerated.size(), store.getOutgoingDelegations(VAULT).size());
    }

    private static Address delegateFor(int thread, int index) {
        return new Address(String.format("0x%040x", 0x10000 + thread * 1000 + index));
    }
}
