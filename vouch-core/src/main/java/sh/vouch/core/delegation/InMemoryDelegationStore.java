// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.delegation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vouch.core.DebugLogger;
import sh.vouch.core.LogFormatter;
import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * {@link DelegationStore} backed by concurrent hash maps.
 *
 * <p>Mutations are serialized on a single lock, so each {@code setDelegation} (and each
 * batch) is applied atomically and listeners observe events in mutation order. Listeners
 * run only once every write of the call is in place: a listener that throws, even an
 * {@link Error}, cannot leave a batch half-applied. Reads go straight to the maps and
 * never take the lock.
 *
 * <p>Besides the slot map, two indexes hold the identities of currently enabled records,
 * one by vault and one by delegate. Disabled records stay in the slot map only.
 *
 * <pre>{@code
 * DelegationStore store = new InMemoryDelegationStore();
 * Hash id = store.setDelegation(DelegationRequest.all(vault, hotWallet, Rights.ALL, true));
 * store.readRecord(id).enabled();   // true
 * }</pre>
 *
 * @since 0.1.0
 */
public final class InMemoryDelegationStore implements DelegationStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDelegationStore.class);

    private final DelegationStoreConfig config;
    private final Map<Hash, DelegationRecord> slots;
    private final Map<Address, Set<Hash>> outgoing;
    private final Map<Address, Set<Hash>> incoming;
    private final List<DelegationListener> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    public InMemoryDelegationStore() {
        this(DelegationStoreConfig.defaults());
    }

    public InMemoryDelegationStore(DelegationStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.slots = new ConcurrentHashMap<>(config.initialCapacity());
        this.outgoing = new ConcurrentHashMap<>();
        this.incoming = new ConcurrentHashMap<>();
    }

    public DelegationStoreConfig config() {
        return config;
    }

    @Override
    public Hash setDelegation(
            DelegationType type,
            Address from,
            Address to,
            Address contract,
            BigInteger tokenId,
            Rights rights,
            BigInteger amount,
            boolean enable) {
        final DelegationRequest request = validate(
                new DelegationRequest(type, from, to, contract, tokenId, rights, amount, enable));
        final Hash identity = DelegationHashes.compute(
                request.type(), request.from(), request.to(), request.contract(), request.tokenId(), request.rights());
        synchronized (writeLock) {
            notifyListeners(List.of(apply(identity, request)));
        }
        return identity;
    }

    @Override
    public List<Hash> setDelegations(List<DelegationRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        final List<DelegationRequest> validated = new ArrayList<>(requests.size());
        final List<Hash> identities = new ArrayList<>(requests.size());
        for (DelegationRequest request : requests) {
            final DelegationRequest checked = validate(Objects.requireNonNull(request, "request"));
            validated.add(checked);
            identities.add(DelegationHashes.compute(
                    checked.type(), checked.from(), checked.to(), checked.contract(), checked.tokenId(),
                    checked.rights()));
        }
        synchronized (writeLock) {
            final List<DelegationChanged> events = new ArrayList<>(validated.size());
            for (int i = 0; i < validated.size(); i++) {
                events.add(apply(identities.get(i), validated.get(i)));
            }
            notifyListeners(events);
        }
        return List.copyOf(identities);
    }

    @Override
    public DelegationRecord readRecord(Hash identity) {
        Objects.requireNonNull(identity, "identity");
        return slots.getOrDefault(identity, DelegationRecord.none());
    }

    @Override
    public List<DelegationRecord> getOutgoingDelegations(Address from) {
        return enabledRecords(outgoing.get(Objects.requireNonNull(from, "from")));
    }

    @Override
    public List<DelegationRecord> getIncomingDelegations(Address to) {
        return enabledRecords(incoming.get(Objects.requireNonNull(to, "to")));
    }

    @Override
    public List<Hash> getOutgoingDelegationHashes(Address from) {
        final Set<Hash> ids = outgoing.get(Objects.requireNonNull(from, "from"));
        return ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public List<Hash> getIncomingDelegationHashes(Address to) {
        final Set<Hash> ids = incoming.get(Objects.requireNonNull(to, "to"));
        return ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public void addListener(DelegationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(DelegationListener listener) {
        listeners.remove(listener);
    }

    private DelegationRequest validate(DelegationRequest request) {
        try {
            return DelegationValidator.validate(request, config.scopeValidation());
        } catch (InvalidDelegationException e) {
            DebugLogger.logStore(LogFormatter.formatRejection("setDelegation", e.reason().name()));
            throw e;
        }
    }

    // Caller holds writeLock.
    private DelegationChanged apply(Hash identity, DelegationRequest request) {
        final DelegationRecord previous = slots.get(identity);
        if (request.enable()) {
            slots.put(identity, request.toRecord(true));
            index(outgoing, request.from(), identity);
            index(incoming, request.to(), identity);
        } else {
            // keep the last written amount of an existing slot
            slots.put(identity, previous != null ? previous.withEnabled(false) : request.toRecord(false));
            unindex(outgoing, request.from(), identity);
            unindex(incoming, request.to(), identity);
        }

        LOG.debug("{} {} delegation {} from {} to {}",
                request.enable() ? "enabled" : "disabled", request.type(), identity, request.from(), request.to());
        DebugLogger.logStore(LogFormatter.formatDelegation(
                request.type().name(),
                request.from(),
                request.to(),
                request.contract(),
                request.tokenId(),
                request.rights(),
                request.amount(),
                request.enable(),
                identity));
        return DelegationChanged.of(identity, request);
    }

    // Runs after every write of the call is in place, still under writeLock so events keep mutation order.
    private void notifyListeners(List<DelegationChanged> events) {
        for (DelegationChanged event : events) {
            for (DelegationListener listener : listeners) {
                try {
                    listener.onDelegationChanged(event);
                } catch (RuntimeException e) {
                    LOG.warn("Delegation listener {} failed for {}", listener, event.identity(), e);
                }
            }
        }
    }

    private List<DelegationRecord> enabledRecords(@Nullable Set<Hash> identities) {
        if (identities == null || identities.isEmpty()) {
            return List.of();
        }
        final List<DelegationRecord> out = new ArrayList<>(identities.size());
        for (Hash identity : identities) {
            final DelegationRecord record = slots.get(identity);
            if (record != null && record.enabled()) {
                out.add(record);
            }
        }
        return List.copyOf(out);
    }

    private static void index(Map<Address, Set<Hash>> index, Address key, Hash identity) {
        index.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(identity);
    }

    private static void unindex(Map<Address, Set<Hash>> index, Address key, Hash identity) {
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(identity);
            return ids.isEmpty() ? null : ids;
        });
    }
}
