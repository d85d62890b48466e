package com.retrygate.core.store;

import com.retrygate.core.spi.PolicyStore;
import com.retrygate.mapper.SystemSettingMapper;
import com.retrygate.model.Setting;
import com.retrygate.model.entity.SystemSettingEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.ZoneId;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 system_settings 表的配置存储
 */
public class MybatisPolicyStore implements PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisPolicyStore.class);

    private final SystemSettingMapper mapper;

    /** 多 key 写入的编程式事务 */
    private final TransactionTemplate tt;

    private final ZoneId zone;

    public MybatisPolicyStore(SystemSettingMapper mapper, TransactionTemplate tt) {
        this(mapper, tt, ZoneId.systemDefault());
    }

    public MybatisPolicyStore(SystemSettingMapper mapper, TransactionTemplate tt, ZoneId zone) {
        this.mapper = mapper;
        this.tt = tt;
        this.zone = zone;
    }

    @Override
    public Optional<Setting> find(String key) {
        StorageCalls.requireKey(key);
        SystemSettingEntity e = StorageCalls.call("policy.find", () -> mapper.selectByKey(key));
        return Optional.ofNullable(e).map(this::toSetting);
    }

    @Override
    public Map<String, String> getAll(Collection<String> keys) {
        keys.forEach(StorageCalls::requireKey);
        List<SystemSettingEntity> rows = StorageCalls.call("policy.getAll", () -> mapper.selectByKeys(keys));
        Map<String, String> ret = new HashMap<>();
        for (SystemSettingEntity row : rows) {
            if (row.getSettingValue() != null) {
                ret.put(row.getSettingKey(), row.getSettingValue());
            }
        }
        return ret;
    }

    @Override
    public void set(String key, String value) {
        StorageCalls.requireKey(key);
        StorageCalls.run("policy.set", () -> mapper.upsert(key, value, null));
        log.debug("[Policy-Store] set key={} value={}", key, value);
    }

    @Override
    public void setAll(Map<String, String> values, Map<String, String> descriptions) {
        values.keySet().forEach(StorageCalls::requireKey);
        if (values.isEmpty()) {
            return;
        }
        // 同一事务内写入, 任一失败整体回滚
        StorageCalls.run("policy.setAll", () -> tt.executeWithoutResult(status ->
                values.forEach((k, v) -> mapper.upsert(k, v, descriptions.get(k)))));
        log.debug("[Policy-Store] setAll keys={}", values.keySet());
    }

    private Setting toSetting(SystemSettingEntity e) {
        return new Setting(e.getSettingKey(), e.getSettingValue(), e.getDescription(),
                e.getUpdatedAt() == null ? null : e.getUpdatedAt().atZone(zone).toInstant());
    }
}
