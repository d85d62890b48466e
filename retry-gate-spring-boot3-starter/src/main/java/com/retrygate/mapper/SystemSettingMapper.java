package com.retrygate.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.retrygate.model.entity.SystemSettingEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

@Mapper
public interface SystemSettingMapper extends BaseMapper<SystemSettingEntity> {

    /**
     * 单条读取
     */
    @Select("""
        SELECT id, setting_key, setting_value, description, updated_at
          FROM system_settings
         WHERE setting_key = #{key}
    """)
    SystemSettingEntity selectByKey(@Param("key") String key);

    /**
     * 一条语句读取多个 key, 保证看到同一次提交的结果
     */
    @Select({
            "<script>",
            "SELECT id, setting_key, setting_value, description, updated_at",
            "  FROM system_settings",
            " WHERE 1 = 1",
            "   <if test='keys != null and keys.size() > 0'>",
            "     AND setting_key IN",
            "     <foreach collection='keys' item='k' open='(' separator=',' close=')'>",
            "       #{k}",
            "     </foreach>",
            "   </if>",
            "   <if test='keys == null or keys.size() == 0'>",
            "     AND 1 = 0",
            "   </if>",
            "</script>"
    })
    List<SystemSettingEntity> selectByKeys(@Param("keys") Collection<String> keys);

    /**
     * upsert：不存在则插入, 存在则覆盖值并刷新 updated_at;
     * description 仅在传入非空时覆盖
     */
    @Insert("""
        INSERT INTO system_settings (setting_key, setting_value, description, updated_at)
        VALUES (#{key}, #{value}, #{description}, CURRENT_TIMESTAMP(3))
        ON DUPLICATE KEY UPDATE
            setting_value = VALUES(setting_value),
            description = COALESCE(VALUES(description), description),
            updated_at = CURRENT_TIMESTAMP(3)
    """)
    int upsert(@Param("key") String key,
               @Param("value") String value,
               @Param("description") String description);
}
