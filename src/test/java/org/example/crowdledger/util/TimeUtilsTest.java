package org.example.crowdledger.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

public class TimeUtilsTest {

    private static final long GENESIS = 1_704_067_200L;

    @Test
    @DisplayName("periods are 30 days counted from genesis")
    void elapsedPeriods() {
        assertEquals(0, TimeUtils.elapsedPeriods(GENESIS, GENESIS));
        assertEquals(0, TimeUtils.elapsedPeriods(GENESIS + TimeUtils.PERIOD_SECONDS - 1, GENESIS));
        assertEquals(1, TimeUtils.elapsedPeriods(GENESIS + TimeUtils.PERIOD_SECONDS, GENESIS));
        assertEquals(GENESIS + 2 * TimeUtils.PERIOD_SECONDS, TimeUtils.periodStart(GENESIS, 2));
    }

    @Test
    @DisplayName("timestamps before genesis are rejected")
    void beforeGenesis() {
        assertThrows(IllegalArgumentException.class, () -> TimeUtils.elapsedPeriods(GENESIS - 1, GENESIS));
    }
}
