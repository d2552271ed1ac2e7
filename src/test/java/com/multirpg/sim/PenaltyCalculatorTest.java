package com.multirpg.sim;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PenaltyCalculatorTest {

    @Test
    void levelZeroPaysTheBase() {
        PenaltyCalculator calc = new PenaltyCalculator(0);
        assertEquals(30, calc.penalty(30, 0));
        assertEquals(0, calc.penalty(0, 40));
    }

    @Test
    void growsByFourteenPercentPerLevelRoundedDown() {
        PenaltyCalculator calc = new PenaltyCalculator(0);
        assertEquals(34, calc.penalty(30, 1));   // 34.2
        assertEquals(129, calc.penalty(100, 2));  // 129.96
    }

    @Test
    void neverDecreasesWithLevel() {
        PenaltyCalculator calc = new PenaltyCalculator(0);
        for (int base : new int[] {1, 20, 30, 200, 250}) {
            int prev = -1;
            for (int level = 0; level <= 120; level++) {
                int pen = calc.penalty(base, level);
                assertTrue(pen >= prev, "base " + base + " level " + level);
                prev = pen;
            }
        }
    }

    @Test
    void capAppliesOnlyAboveTheLimit() {
        PenaltyCalculator calc = new PenaltyCalculator(100);
        assertEquals(30, calc.penalty(30, 0));
        assertEquals(100, calc.penalty(200, 5));
        assertEquals(100, calc.penalty(250, 60));
    }

    @Test
    void messagePenaltyUsesTheMessageLength() {
        PenaltyCalculator calc = new PenaltyCalculator(0);
        assertEquals(12, calc.penalty(PenaltyKind.MESSAGE, 0, 12));
        assertEquals(0, calc.penalty(PenaltyKind.MESSAGE, 10, 0));
        assertEquals(30, calc.penalty(PenaltyKind.NICK, 0, 999));
    }

    @Test
    void questWrathIsNotCapped() {
        PenaltyCalculator calc = new PenaltyCalculator(10);
        assertTrue(calc.penalty(PenaltyKind.QUEST, 10, 0) > 10);
        assertEquals(10, calc.penalty(PenaltyKind.PART, 10, 0));
    }

    @Test
    void hugeLevelsSaturateInsteadOfOverflowing() {
        PenaltyCalculator calc = new PenaltyCalculator(0);
        assertEquals(Integer.MAX_VALUE, calc.penalty(250, 500));
    }

    @Test
    void levelCountdownStartsAtTenMinutesAndAddsADayPastSixty() {
        assertEquals(600, PenaltyCalculator.baseTtl(0));
        assertTrue(PenaltyCalculator.baseTtl(30) > PenaltyCalculator.baseTtl(29));
        int step = PenaltyCalculator.baseTtl(62) - PenaltyCalculator.baseTtl(61);
        assertTrue(Math.abs(step - 86400) <= 1, "step was " + step);
    }
}
