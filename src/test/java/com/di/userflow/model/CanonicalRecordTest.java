package com.di.userflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CanonicalRecord Tests")
class CanonicalRecordTest {

    @Test
    @DisplayName("Should key the record by username")
    void testKey() {
        CanonicalRecord r = new CanonicalRecord("Jane", "Doe", "US", "jdoe", "x");
        assertEquals("jdoe", r.key());
        assertEquals("Doe", r.field("lastName"));
        assertThrows(IllegalArgumentException.class, () -> r.field("email"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Should reject blank required fields")
    void testBlankField(String blank) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new CanonicalRecord("Jane", "Doe", blank, "jdoe", "x"));
        assertTrue(ex.getMessage().contains("country"));
    }

    @Test
    @DisplayName("Should reject null required fields")
    void testNullField() {
        assertThrows(IllegalArgumentException.class,
                () -> new CanonicalRecord("Jane", "Doe", "US", null, "x"));
    }

    @Test
    @DisplayName("Should never print the password")
    void testToStringMasksPassword() {
        String text = new CanonicalRecord("Jane", "Doe", "US", "jdoe", "s3cret").toString();
        assertFalse(text.contains("s3cret"));
        assertTrue(text.contains("jdoe"));
    }

    @Test
    @DisplayName("Should list the canonical fields with the key first")
    void testFields() {
        assertEquals("username", CanonicalRecord.FIELDS.get(0));
        assertEquals(5, CanonicalRecord.FIELDS.size());
    }
}
