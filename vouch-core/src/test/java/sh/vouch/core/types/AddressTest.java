// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void acceptsValidAddress() {
        Address address = new Address("0x000000000000000000000000000000000000dEaD");
        assertEquals("0x000000000000000000000000000000000000dead", address.value());
        assertEquals(20, address.toBytes().length);
    }

    @Test
    void checksummedAndLowercaseSpellingsAreEqual() {
        assertEquals(
                new Address("0x52908400098527886E0F7030069857D2E4169EE7"),
                new Address("0x52908400098527886e0f7030069857d2e4169ee7"));
    }

    @Test
    void rejectsInvalidLength() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
    }

    @Test
    void rejectsMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new Address("1234567890abcdef1234567890abcdef12345678"));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void zeroAddress() {
        assertTrue(Address.ZERO.isZero());
        assertFalse(new Address("0x" + "0".repeat(39) + "1").isZero());
    }

    @Test
    void roundTripBytes() {
        Address original = new Address("0x1234567890abcdef1234567890abcdef12345678");
        assertEquals(original, Address.fromBytes(original.toBytes()));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }
}
