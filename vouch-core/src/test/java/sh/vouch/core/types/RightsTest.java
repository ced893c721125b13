// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vouch.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RightsTest {

    private static final Rights AIRDROP = Rights.ofLabel("airdrop");
    private static final Rights GOVERNANCE = Rights.ofLabel("governance");

    @Test
    void labelIsLeftAlignedUtf8() {
        assertEquals("0x61697264726f70" + "0".repeat(50), AIRDROP.value());
    }

    @Test
    void labelLengthLimits() {
        assertThrows(IllegalArgumentException.class, () -> Rights.ofLabel(""));
        assertThrows(IllegalArgumentException.class, () -> Rights.ofLabel("x".repeat(33)));
        assertEquals(32, Rights.ofLabel("x".repeat(32)).toBytes().length);
    }

    @Test
    void zeroTagIsAll() {
        assertTrue(Rights.ALL.isAll());
        assertTrue(Rights.fromBytes(new byte[32]).isAll());
        assertFalse(AIRDROP.isAll());
    }

    @Test
    void allRightsSatisfyEveryQuery() {
        assertTrue(Rights.ALL.satisfies(Rights.ALL));
        assertTrue(Rights.ALL.satisfies(AIRDROP));
    }

    @Test
    void narrowedRightsSatisfyOnlyThemselves() {
        assertTrue(AIRDROP.satisfies(AIRDROP));
        assertFalse(AIRDROP.satisfies(GOVERNANCE));
        assertFalse(AIRDROP.satisfies(Rights.ALL));
    }

    @Test
    void rejectsMalformedHex() {
        assertThrows(IllegalArgumentException.class, () -> Rights.fromHex("0x1234"));
        assertThrows(NullPointerException.class, () -> Rights.fromHex(null));
        assertThrows(IllegalArgumentException.class, () -> Rights.fromBytes(new byte[31]));
    }
}
