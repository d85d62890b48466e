package com.retrygate.model;

import com.retrygate.exception.InvalidPolicyValueException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PolicyUpdateTest {

    @Test
    void test_from_raw_parses_both_fields() {
        PolicyUpdate u = PolicyUpdate.fromRaw("False", " 5 ");
        assertEquals(Boolean.FALSE, u.getEnabled());
        assertEquals(5, u.getMaxAttempts());
        assertFalse(u.isEmpty());
    }

    @Test
    void test_blank_means_not_provided() {
        PolicyUpdate u = PolicyUpdate.fromRaw("  ", null);
        assertNull(u.getEnabled());
        assertNull(u.getMaxAttempts());
        assertTrue(u.isEmpty());
    }

    @Test
    void test_malformed_values_rejected() {
        InvalidPolicyValueException e = assertThrows(InvalidPolicyValueException.class,
                () -> PolicyUpdate.fromRaw(null, "three"));
        assertEquals("maxAttempts", e.getField());
        assertEquals("three", e.getRejectedValue());

        e = assertThrows(InvalidPolicyValueException.class, () -> PolicyUpdate.fromRaw("on", null));
        assertEquals("enabled", e.getField());
    }

    @Test
    void test_snapshot_merge() {
        RetryPolicySnapshot before = RetryPolicySnapshot.of(true, 3);
        assertEquals(RetryPolicySnapshot.of(false, 3),
                before.merge(PolicyUpdate.builder().enabled(false).build()));
        assertEquals(RetryPolicySnapshot.of(true, 0),
                before.merge(PolicyUpdate.builder().maxAttempts(0).build()));
        assertFalse(RetryPolicySnapshot.of(true, 0).limitsActive());
        assertFalse(RetryPolicySnapshot.of(false, 3).limitsActive());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicySnapshot.of(true, -1));
    }
}
