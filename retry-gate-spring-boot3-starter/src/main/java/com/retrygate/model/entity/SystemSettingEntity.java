package com.retrygate.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 系统级配置 key-value 表
 * 已知 key：
 * - transcription.max_retries          最大重试次数（默认3, 0=不限）
 * - transcription.retry_limit_enabled  是否启用重试上限（默认true）
 */
@TableName("system_settings")
@Data
public class SystemSettingEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 唯一键（`key` 为保留字, 列名用 setting_key） */
    @TableField("setting_key")
    private String settingKey;

    @TableField("setting_value")
    private String settingValue;

    private String description;

    private LocalDateTime updatedAt;
}
