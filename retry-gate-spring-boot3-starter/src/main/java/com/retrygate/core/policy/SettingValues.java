package com.retrygate.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 配置值解析, 非法值回落默认值而不是抛给调用方
 */
public final class SettingValues {

    private static final Logger log = LoggerFactory.getLogger(SettingValues.class);

    private SettingValues() {}

    public static int parseInt(String key, String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[Setting] key={} has non-integer value '{}', fallback to {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public static boolean parseBoolean(String key, String raw, boolean defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) {
            return true;
        }
        if (v.equals("false")) {
            return false;
        }
        log.warn("[Setting] key={} has non-boolean value '{}', fallback to {}", key, raw, defaultValue);
        return defaultValue;
    }
}
