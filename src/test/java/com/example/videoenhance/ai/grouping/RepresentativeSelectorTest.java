package com.example.videoenhance.ai.grouping;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RepresentativeSelectorTest {

    private final RepresentativeSelector selector = new RepresentativeSelector();

    @Test
    public void testSelect_ReturnsMidpoint() {
        assertEquals(5, selector.select(0, 10));
        assertEquals(12, selector.select(10, 15));
        assertEquals(7, selector.select(7, 8));
    }

    @Test
    public void testSelect_EmptyRange_Throws() {
        assertThrows(IllegalArgumentException.class, () -> selector.select(4, 4));
    }
}
