package com.pmr.collab.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColorAssignerTest {

    @Test
    public void testColorIsStablePerUser() {
        ColorAssigner first = new ColorAssigner();
        ColorAssigner second = new ColorAssigner();
        assertEquals(first.colorFor("user-42"), second.colorFor("user-42"));
        assertEquals(first.colorFor("user-42"), first.colorFor("user-42"));
    }

    @Test
    public void testColorComesFromPalette() {
        ColorAssigner colors = new ColorAssigner();
        for (String userId : new String[]{"a", "b", "alice@example.com", "", "üser"}) {
            assertTrue(ColorAssigner.PALETTE.contains(colors.colorFor(userId)), userId);
        }
    }

    @Test
    public void testNegativeHashCodeStillMapsIntoPalette() {
        // "polygenelubricants".hashCode() == Integer.MIN_VALUE
        assertTrue(ColorAssigner.PALETTE.contains(new ColorAssigner().colorFor("polygenelubricants")));
    }
}
