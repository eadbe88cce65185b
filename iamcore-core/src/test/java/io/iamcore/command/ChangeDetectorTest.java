package io.iamcore.command;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeDetectorTest {

    @Test
    void equalValuesAreNoChange() {
        ChangeDetector changes = new ChangeDetector();

        assertNull(changes.diff("smtp.example.com", "smtp.example.com"));
        assertNull(changes.diff(true, true));
        assertFalse(changes.hasChanges());
    }

    @Test
    void differingValuesAreReturned() {
        ChangeDetector changes = new ChangeDetector();

        assertEquals("b", changes.diff("a", "b"));
        assertEquals(Boolean.FALSE, changes.diff(true, false));
        assertTrue(changes.hasChanges());
        assertEquals(2, changes.changedFields());
    }

    @Test
    void nullProposalLeavesFieldUnchanged() {
        ChangeDetector changes = new ChangeDetector();

        assertNull(changes.diff("a", null));
        assertFalse(changes.hasChanges());
    }

    @Test
    void settingPreviouslyUnsetFieldIsChange() {
        ChangeDetector changes = new ChangeDetector();

        assertEquals("a", changes.diff(null, "a"));
        assertTrue(changes.hasChanges());
    }

    @Test
    void alwaysCountsNonNullValues() {
        ChangeDetector changes = new ChangeDetector();

        assertNull(changes.always(null));
        assertFalse(changes.hasChanges());
        assertEquals("secret", changes.always("secret"));
        assertTrue(changes.hasChanges());
    }
}
