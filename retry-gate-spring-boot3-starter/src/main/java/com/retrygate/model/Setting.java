package com.retrygate.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 系统配置项
 */
@Getter
@AllArgsConstructor
@ToString
public class Setting {

    private final String key;

    private final String value;

    /** 说明, 未写入过时为 null */
    private final String description;

    private final Instant updatedAt;
}
