package com.retrygate.core.store;

import com.retrygate.core.spi.PolicyStore;
import com.retrygate.model.Setting;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 内存配置存储, 未配置 DataSource 时使用
 * 整张表是一个不可变 Map, 写入以一次引用替换完成, setAll 天然原子
 */
public class InMemoryPolicyStore implements PolicyStore {

    private final AtomicReference<Map<String, Setting>> table = new AtomicReference<>(Map.of());

    private final Clock clock;

    public InMemoryPolicyStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPolicyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Setting> find(String key) {
        StorageCalls.requireKey(key);
        return Optional.ofNullable(table.get().get(key));
    }

    @Override
    public Map<String, String> getAll(Collection<String> keys) {
        keys.forEach(StorageCalls::requireKey);
        Map<String, Setting> snapshot = table.get();
        Map<String, String> ret = new HashMap<>();
        for (String k : keys) {
            Setting s = snapshot.get(k);
            if (s != null && s.getValue() != null) {
                ret.put(k, s.getValue());
            }
        }
        return ret;
    }

    @Override
    public void set(String key, String value) {
        setAll(Collections.singletonMap(key, value), Map.of());
    }

    @Override
    public void setAll(Map<String, String> values, Map<String, String> descriptions) {
        values.keySet().forEach(StorageCalls::requireKey);
        Instant now = clock.instant();
        table.updateAndGet(current -> {
            Map<String, Setting> next = new HashMap<>(current);
            values.forEach((k, v) -> {
                // 与 upsert 一致：未给说明时保留原说明
                String desc = descriptions.get(k);
                if (desc == null && current.containsKey(k)) {
                    desc = current.get(k).getDescription();
                }
                next.put(k, new Setting(k, v, desc, now));
            });
            return Collections.unmodifiableMap(next);
        });
    }
}
