package com.retrygate.core.spi;

import com.retrygate.core.policy.SettingValues;
import com.retrygate.model.Setting;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 系统配置存储
 * 存储不可用时抛出 {@link com.retrygate.exception.StorageUnavailableException}
 */
public interface PolicyStore {

    /** 读取完整记录（含更新时间） */
    Optional<Setting> find(String key);

    /** 一次读取多个 key, 不存在的 key 不出现在结果中 */
    Map<String, String> getAll(Collection<String> keys);

    /** 覆盖或新建 */
    void set(String key, String value);

    /**
     * 多个 key 作为一个原子单元写入, 并发读者不会看到只写了一半
     * @param descriptions key 的说明, 可为空; 未给说明的 key 保留原说明
     */
    void setAll(Map<String, String> values, Map<String, String> descriptions);

    default void setAll(Map<String, String> values) {
        setAll(values, Map.of());
    }

    default Optional<String> get(String key) {
        return find(key).map(Setting::getValue);
    }

    default String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /** 缺失或无法解析时返回默认值 */
    default int getInt(String key, int defaultValue) {
        return SettingValues.parseInt(key, get(key).orElse(null), defaultValue);
    }

    /** 缺失或无法解析时返回默认值 */
    default boolean getBoolean(String key, boolean defaultValue) {
        return SettingValues.parseBoolean(key, get(key).orElse(null), defaultValue);
    }
}
