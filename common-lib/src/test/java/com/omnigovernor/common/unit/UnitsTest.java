package com.omnigovernor.common.unit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class UnitsTest {

    @Test
    @DisplayName("configured safety margins convert exactly")
    void etherMargins() {
        assertEquals(new BigInteger("5000000000000000"), Units.etherToWei("0.005"));
        assertEquals(new BigInteger("3500000000000000"), Units.etherToWei("0.0035"));
        assertEquals(new BigInteger("1000000000000000"), Units.etherToWei("0.001"));
    }

    @Test
    @DisplayName("configured priority fees convert exactly")
    void gweiPriorities() {
        assertEquals(new BigInteger("500000000000"), Units.gweiToWei("500.0"));
        assertEquals(new BigInteger("1600000000"), Units.gweiToWei("1.6"));
    }

    @Test
    @DisplayName("sub-wei precision is rejected")
    void subWei() {
        assertThrows(IllegalArgumentException.class, () -> Units.gweiToWei("0.0000000001"));
        assertThrows(IllegalArgumentException.class, () -> Units.etherToWei(" "));
    }

    @Test
    @DisplayName("formatEther strips trailing zeros")
    void formatEther() {
        assertEquals("1.5", Units.formatEther(new BigInteger("1500000000000000000")));
        assertEquals("0.00000000001", Units.formatEther(BigInteger.valueOf(10_000_000L)));
        assertEquals("0.0", Units.formatEther(BigInteger.ZERO));
    }
}
