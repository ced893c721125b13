// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.examples;

import java.math.BigInteger;

import sh.vouch.core.VouchDebug;
import sh.vouch.core.delegation.AuthorizationResolver;
import sh.vouch.core.delegation.DelegationRecord;
import sh.vouch.core.delegation.DelegationRequest;
import sh.vouch.core.delegation.DelegationStoreConfig;
import sh.vouch.core.delegation.DelegationType;
import sh.vouch.core.delegation.Delegator;
import sh.vouch.core.delegation.InMemoryDelegationStore;
import sh.vouch.core.error.InvalidDelegationException;
import sh.vouch.core.error.UnauthorizedDelegationException;
import sh.vouch.core.types.Address;
import sh.vouch.core.types.Hash;
import sh.vouch.core.types.Rights;

/**
 * Walks through granting, checking and revoking delegations against an in-memory registry.
 *
 * <p>Usage:
 *
 * <p>1) Grants and hierarchical checks:
 * <pre>
 * mvn -pl vouch-examples exec:java \
 *   -Dexec.mainClass=sh.vouch.examples.DelegationWalkthrough \
 *   -Dvouch.examples.mode=grants
 * </pre>
 *
 * <p>2) Rejected requests:
 * <pre>
 * mvn -pl vouch-examples exec:java \
 *   -Dexec.mainClass=sh.vouch.examples.DelegationWalkthrough \
 *   -Dvouch.examples.mode=errors
 * </pre>
 *
 * <p>Add {@code -Dvouch.debug=true} to see the store and resolver trace lines.
 */
public final class DelegationWalkthrough {

        private static final Address VAULT = new Address("0x1111111111111111111111111111111111111111");
        private static final Address HOT_WALLET = new Address("0x2222222222222222222222222222222222222222");
        private static final Address STRANGER = new Address("0x6666666666666666666666666666666666666666");
        private static final Address COLLECTION = new Address("0xc0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0");
        private static final Address TOKEN = new Address("0xe2e2e2e2e2e2e2e2e2e2e2e2e2e2e2e2e2e2e2e2");

        private DelegationWalkthrough() {
        }

        public static void main(String[] args) {
                final String mode = System.getProperty("vouch.examples.mode", "grants");
                switch (mode) {
                        case "grants" -> runGrantsDemo();
                        case "errors" -> runErrorsDemo();
                        case "debug" -> {
                                VouchDebug.setEnabled(true);
                                runGrantsDemo();
                        }
                        default -> {
                                System.out.println("Unknown mode: " + mode);
                                System.out.println("Use -Dvouch.examples.mode=grants, errors or debug");
                        }
                }
        }

        private static void runGrantsDemo() {
                System.out.println("=== Grants demo ===");
                final InMemoryDelegationStore store = new InMemoryDelegationStore();
                store.addListener(event -> System.out.println(
                                "[event] " + (event.enable() ? "grant " : "revoke ") + event.type() + " " + event.identity()));
                final Delegator vault = Delegator.bind(store, VAULT);
                final AuthorizationResolver resolver = new AuthorizationResolver(store);
                final Rights airdrop = Rights.ofLabel("airdrop");
                final BigInteger seven = BigInteger.valueOf(7);
                final BigInteger eight = BigInteger.valueOf(8);

                // 1) Token-level grant
                final Hash tokenGrant = vault.delegateErc721(HOT_WALLET, COLLECTION, seven, Rights.ALL, true);
                System.out.println("token #7 authorized = "
                                + resolver.check(HOT_WALLET, VAULT, COLLECTION, seven, Rights.ALL));
                System.out.println("token #8 authorized = "
                                + resolver.check(HOT_WALLET, VAULT, COLLECTION, eight, Rights.ALL));

                // 2) Contract-level grant narrowed to one right
                vault.delegateContract(HOT_WALLET, COLLECTION, airdrop, true);
                System.out.println("token #8 airdrop    = "
                                + resolver.check(HOT_WALLET, VAULT, COLLECTION, eight, airdrop));
                System.out.println("token #8 all rights = "
                                + resolver.check(HOT_WALLET, VAULT, COLLECTION, eight, Rights.ALL));

                // 3) Fungible amounts
                vault.delegateErc20(HOT_WALLET, TOKEN, Rights.ALL, BigInteger.valueOf(1_000), true);
                System.out.println("erc20 allowance     = "
                                + resolver.checkDelegateForErc20(HOT_WALLET, VAULT, TOKEN, Rights.ALL));

                // 4) Revoke and re-read
                vault.delegateErc721(HOT_WALLET, COLLECTION, seven, Rights.ALL, false);
                final DelegationRecord revoked = store.readRecord(tokenGrant);
                System.out.println("token #7 record enabled = " + revoked.enabled());

                System.out.println("outgoing delegations of vault:");
                for (DelegationRecord record : vault.outgoingDelegations()) {
                        System.out.println("  " + record.type() + " -> " + record.to() + " rights=" + record.rights());
                }
        }

        private static void runErrorsDemo() {
                System.out.println("=== Errors demo ===");
                final InMemoryDelegationStore store = new InMemoryDelegationStore();

                try {
                        store.setDelegation(DelegationRequest.all(VAULT, VAULT, Rights.ALL, true));
                } catch (InvalidDelegationException e) {
                        System.out.println("[self-delegation] reason = " + e.reason() + ", message = " + e.getMessage());
                }

                try {
                        store.setDelegation(DelegationRequest.erc721(
                                        VAULT, HOT_WALLET, COLLECTION, BigInteger.valueOf(-1), Rights.ALL, true));
                } catch (InvalidDelegationException e) {
                        System.out.println("[negative token] reason = " + e.reason());
                }

                try {
                        Delegator.bind(store, STRANGER).setDelegation(
                                        DelegationRequest.all(VAULT, STRANGER, Rights.ALL, true));
                } catch (UnauthorizedDelegationException e) {
                        System.out.println("[unauthorized] caller = " + e.caller() + ", vault = " + e.vault());
                }

                final InMemoryDelegationStore lenient = new InMemoryDelegationStore(DelegationStoreConfig.builder()
                                .scopeValidation(DelegationStoreConfig.ScopeValidation.NORMALIZE)
                                .build());
                final Hash id = lenient.setDelegation(new DelegationRequest(
                                DelegationType.ALL,
                                VAULT, HOT_WALLET, COLLECTION, BigInteger.TEN, Rights.ALL, BigInteger.ZERO, true));
                System.out.println("[normalize] stored contract = " + lenient.readRecord(id).contract());
        }
}
