package com.mystery.analysis;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TextOverlapTest {

    @Test
    public void shortAndStopWordsAreNotSignificant() {
        assertEquals(Set.of("emma", "cellar", "didn't"), TextOverlap.significantWords("Where was Emma? The cellar, I didn't go."));
    }

    @Test
    public void halfOfTheSignificantWordsIsEnough() {
        assertTrue(TextOverlap.overlaps("Nick found an empty antifreeze container", "There was antifreeze in a container, Nick said"));
        assertFalse(TextOverlap.overlaps("Nick found an empty antifreeze container", "Nick was in the library"));
    }

    @Test
    public void quotedTextAlwaysOverlaps() {
        assertTrue(TextOverlap.overlaps("the garden shed?", "He said the garden shed was locked."));
        assertFalse(TextOverlap.overlaps(null, "anything"));
    }
}
