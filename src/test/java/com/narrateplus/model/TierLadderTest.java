package com.narrateplus.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class TierLadderTest
{
    private static final TierConfig LOW = TierConfig.piper("de_DE-thorsten-low");
    private static final TierConfig HIGH = TierConfig.piper("de_DE-thorsten-high");

    private final TierLadder gapped = new TierLadder(Arrays.asList(TierConfig.systemVoice(), LOW, null, HIGH));

    @Test
    public void walksAroundGaps()
    {
        assertEquals(3, gapped.getMaxAvailableTier());
        assertEquals(1, gapped.walkDown(2));
        assertEquals(3, gapped.walkDown(9));
        assertEquals(3, gapped.walkUp(2));
        assertEquals(-1, gapped.walkUp(4));
        assertEquals(0, gapped.walkUp(-3));
        assertEquals(-1, gapped.walkDown(-1));
    }

    @Test
    public void lookupIsBoundsSafe()
    {
        assertFalse(gapped.tier(2).isPresent());
        assertFalse(gapped.tier(-1).isPresent());
        assertFalse(gapped.isAvailable(4));
        assertTrue(gapped.isAvailable(3));
        assertEquals(HIGH, gapped.tier(3).get());
        assertEquals(1, gapped.indexOf(TierConfig.piper("de_DE-thorsten-low")));
        assertEquals(-1, gapped.indexOf(null));
    }

    @Test
    public void ladderWithoutVoices()
    {
        TierLadder empty = new TierLadder(Arrays.asList(null, null));
        assertEquals(-1, empty.getMaxAvailableTier());
        assertEquals(-1, empty.walkUp(0));

        assertEquals(-1, new TierLadder(Collections.emptyList()).walkDown(3));
    }
}
