package com.retrygate.core.store;

import com.retrygate.exception.StorageUnavailableException;
import com.retrygate.mapper.RetryAttemptMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Tag("unit")
public class MybatisRetryCounterStoreTest {

    @Mock
    private RetryAttemptMapper mapper;

    @InjectMocks
    private MybatisRetryCounterStore store;

    @Test
    void test_find() {
        when(mapper.selectAttempts("f1")).thenReturn(2);
        when(mapper.selectAttempts("nope")).thenReturn(null);
        assertEquals(OptionalInt.of(2), store.find("f1"));
        assertEquals(OptionalInt.empty(), store.find("nope"));
    }

    @Test
    void test_compare_and_set() {
        when(mapper.compareAndSetAttempts("f1", 2, 3)).thenReturn(1);
        when(mapper.compareAndSetAttempts("f1", 5, 6)).thenReturn(0);
        assertTrue(store.compareAndSet("f1", 2, 3));
        assertFalse(store.compareAndSet("f1", 5, 6));
    }

    @Test
    void test_reset() {
        when(mapper.resetAttempts("f1")).thenReturn(1);
        when(mapper.resetAttempts("nope")).thenReturn(0);
        when(mapper.selectAttempts("nope")).thenReturn(null);
        assertTrue(store.reset("f1"));
        assertFalse(store.reset("nope"));
    }

    @Test
    void test_reset_of_row_already_at_zero_with_changed_rows_count() {
        // useAffectedRows=true: 值未变化时 UPDATE 返回 0
        when(mapper.resetAttempts("f1")).thenReturn(0);
        when(mapper.selectAttempts("f1")).thenReturn(0);
        assertTrue(store.reset("f1"));
    }

    @Test
    void test_find_latest_uses_locking_read() {
        when(mapper.selectAttemptsForUpdate("f1")).thenReturn(4);
        assertEquals(OptionalInt.of(4), store.findLatest("f1"));
        verify(mapper, never()).selectAttempts("f1");
    }

    @Test
    void test_connection_failure_translated() {
        when(mapper.resetAttempts("f1")).thenThrow(new DataAccessResourceFailureException("connection refused"));
        StorageUnavailableException e = assertThrows(StorageUnavailableException.class, () -> store.reset("f1"));
        assertEquals("counter.reset", e.getOperation());
    }
}
