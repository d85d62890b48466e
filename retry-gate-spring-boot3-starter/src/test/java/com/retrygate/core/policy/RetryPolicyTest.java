package com.retrygate.core.policy;

import com.retrygate.config.RetryGateProperties;
import com.retrygate.core.spi.PolicyStore;
import com.retrygate.core.store.InMemoryPolicyStore;
import com.retrygate.exception.InvalidPolicyValueException;
import com.retrygate.exception.StorageUnavailableException;
import com.retrygate.model.PolicyUpdate;
import com.retrygate.model.RetryPolicySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@Tag("unit")
public class RetryPolicyTest {

    private static final String ENABLED_KEY = "transcription.retry_limit_enabled";
    private static final String MAX_KEY = "transcription.max_retries";

    private InMemoryPolicyStore store;
    private RetryGateProperties.Policy cfg;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryPolicyStore();
        cfg = new RetryGateProperties.Policy();
        cfg.setCacheTtl(Duration.ZERO);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    private RetryPolicy policy() {
        return new RetryPolicy(store, cfg, clock);
    }

    @Test
    void test_defaults_when_keys_missing() {
        RetryPolicySnapshot p = policy().current();
        assertTrue(p.isEnabled());
        assertEquals(3, p.getMaxAttempts());
    }

    @Test
    void test_unparsable_values_fall_back_to_defaults() {
        store.setAll(Map.of(ENABLED_KEY, "yes", MAX_KEY, "abc"));
        RetryPolicy policy = policy();
        assertTrue(policy.isEnabled());
        assertEquals(3, policy.maxAttempts());
    }

    @Test
    void test_out_of_range_stored_value_falls_back() {
        store.set(MAX_KEY, "150");
        assertEquals(3, policy().maxAttempts());
        store.set(MAX_KEY, "-2");
        assertEquals(3, policy().maxAttempts());
    }

    @Test
    void test_stored_values_are_read() {
        store.setAll(Map.of(ENABLED_KEY, "FALSE", MAX_KEY, " 7 "));
        RetryPolicySnapshot p = policy().current();
        assertFalse(p.isEnabled());
        assertEquals(7, p.getMaxAttempts());
    }

    @Test
    void test_partial_update_keeps_other_field() {
        RetryPolicy policy = policy();
        RetryPolicySnapshot after = policy.updatePolicy(PolicyUpdate.builder().maxAttempts(5).build());
        assertEquals(RetryPolicySnapshot.of(true, 5), after);

        after = policy.updatePolicy(PolicyUpdate.builder().enabled(false).build());
        assertEquals(RetryPolicySnapshot.of(false, 5), after);
        assertEquals(Map.of(ENABLED_KEY, "false", MAX_KEY, "5"), store.getAll(List.of(ENABLED_KEY, MAX_KEY)));
        assertEquals(RetryPolicy.MAX_ATTEMPTS_DESCRIPTION, store.find(MAX_KEY).orElseThrow().getDescription());
        assertEquals(RetryPolicy.ENABLED_DESCRIPTION, store.find(ENABLED_KEY).orElseThrow().getDescription());
    }

    @Test
    void test_out_of_range_update_rejected_without_write() {
        RetryPolicy policy = policy();
        policy.updatePolicy(PolicyUpdate.builder().maxAttempts(4).build());

        InvalidPolicyValueException e = assertThrows(InvalidPolicyValueException.class,
                () -> policy.updatePolicy(PolicyUpdate.builder().enabled(false).maxAttempts(150).build()));
        assertEquals("maxAttempts", e.getField());
        assertEquals(150, e.getRejectedValue());

        assertThrows(InvalidPolicyValueException.class,
                () -> policy.updatePolicy(PolicyUpdate.builder().maxAttempts(-1).build()));
        assertEquals(RetryPolicySnapshot.of(true, 4), policy.current());
        assertFalse(store.get(ENABLED_KEY).isPresent());
    }

    @Test
    void test_bounds_are_accepted() {
        RetryPolicy policy = policy();
        assertEquals(0, policy.updatePolicy(PolicyUpdate.builder().maxAttempts(0).build()).getMaxAttempts());
        assertEquals(99, policy.updatePolicy(PolicyUpdate.builder().maxAttempts(99).build()).getMaxAttempts());
    }

    @Test
    void test_empty_update_is_noop() {
        PolicyStore mock = mock(PolicyStore.class);
        when(mock.getAll(anyCollection())).thenReturn(Map.of(MAX_KEY, "6"));
        RetryPolicy policy = new RetryPolicy(mock, cfg, clock);

        RetryPolicySnapshot p = policy.updatePolicy(PolicyUpdate.builder().build());
        assertEquals(RetryPolicySnapshot.of(true, 6), p);
        verify(mock, never()).setAll(any(), any());
    }

    @Test
    void test_update_writes_only_provided_keys() {
        PolicyStore mock = mock(PolicyStore.class);
        when(mock.getAll(anyCollection())).thenReturn(Map.of());
        RetryPolicy policy = new RetryPolicy(mock, cfg, clock);

        policy.updatePolicy(PolicyUpdate.builder().maxAttempts(5).build());
        verify(mock).setAll(Map.of(MAX_KEY, "5"), Map.of(MAX_KEY, RetryPolicy.MAX_ATTEMPTS_DESCRIPTION));
    }

    @Test
    void test_cache_serves_stale_value_until_ttl() {
        cfg.setCacheTtl(Duration.ofSeconds(5));
        RetryPolicy policy = policy();
        assertEquals(3, policy.maxAttempts());

        // 其他节点直接写库
        store.set(MAX_KEY, "8");
        clock.advance(Duration.ofSeconds(4));
        assertEquals(3, policy.maxAttempts());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(8, policy.maxAttempts());
    }

    @Test
    void test_local_update_visible_immediately() {
        cfg.setCacheTtl(Duration.ofMinutes(1));
        RetryPolicy policy = policy();
        assertEquals(3, policy.maxAttempts());
        policy.updatePolicy(PolicyUpdate.builder().maxAttempts(9).build());
        assertEquals(9, policy.maxAttempts());
    }

    @Test
    void test_invalidate_forces_reload() {
        cfg.setCacheTtl(Duration.ofMinutes(1));
        RetryPolicy policy = policy();
        assertEquals(3, policy.maxAttempts());
        store.set(MAX_KEY, "2");
        policy.invalidate();
        assertEquals(2, policy.maxAttempts());
    }

    @Test
    void test_storage_failure_is_not_masked_by_defaults() {
        PolicyStore mock = mock(PolicyStore.class);
        when(mock.getAll(anyCollection())).thenThrow(
                new StorageUnavailableException("policy.getAll", new DataAccessResourceFailureException("down")));
        RetryPolicy policy = new RetryPolicy(mock, cfg, clock);

        assertThrows(StorageUnavailableException.class, policy::current);
        assertThrows(StorageUnavailableException.class,
                () -> policy.updatePolicy(PolicyUpdate.builder().maxAttempts(5).build()));
        verify(mock, never()).setAll(any(), any());
    }

    @Test
    @Tag("concurrency")
    void test_readers_never_see_torn_policy() throws Exception {
        RetryPolicy policy = policy();
        RetryPolicySnapshot a = RetryPolicySnapshot.of(true, 5);
        RetryPolicySnapshot b = RetryPolicySnapshot.of(false, 7);
        policy.updatePolicy(PolicyUpdate.builder().enabled(true).maxAttempts(5).build());

        int readers = 4;
        AtomicBoolean stop = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(readers);
        List<RetryPolicySnapshot> torn = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < readers; i++) {
            new Thread(() -> {
                try {
                    while (!stop.get()) {
                        RetryPolicySnapshot p = policy.current();
                        if (!p.equals(a) && !p.equals(b)) {
                            torn.add(p);
                        }
                    }
                } finally {
                    done.countDown();
                }
            }).start();
        }

        for (int i = 0; i < 500; i++) {
            RetryPolicySnapshot next = i % 2 == 0 ? b : a;
            policy.updatePolicy(PolicyUpdate.builder()
                    .enabled(next.isEnabled()).maxAttempts(next.getMaxAttempts()).build());
        }
        stop.set(true);

        assertTrue(done.await(10, TimeUnit.SECONDS), "readers should finish");
        assertTrue(torn.isEmpty(), "observed torn snapshots: " + torn);
    }
}
