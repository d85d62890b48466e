package com.retrygate.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 只读写 media_file.retry_attempts 一列, 不触碰实体其他字段
 */
@Mapper
public interface RetryAttemptMapper {

    /**
     * 读取计数, 实体不存在返回 null
     */
    @Select("""
        SELECT retry_attempts
          FROM media_file
         WHERE id = #{id}
    """)
    Integer selectAttempts(@Param("id") String id);

    /**
     * 锁定读, 返回最新已提交值（REPEATABLE READ 下普通 SELECT 只能看到事务快照）
     */
    @Select("""
        SELECT retry_attempts
          FROM media_file
         WHERE id = #{id}
           FOR UPDATE
    """)
    Integer selectAttemptsForUpdate(@Param("id") String id);

    /**
     * CAS：仅当当前值等于 expected 时写入 next
     */
    @Update("""
        UPDATE media_file
           SET retry_attempts = #{next}
         WHERE id = #{id}
           AND retry_attempts = #{expected}
    """)
    int compareAndSetAttempts(@Param("id") String id,
                              @Param("expected") int expected,
                              @Param("next") int next);

    /**
     * 无条件归零; 驱动按 changed rows 计数时, 已为0的行也返回 0
     */
    @Update("""
        UPDATE media_file
           SET retry_attempts = 0
         WHERE id = #{id}
    """)
    int resetAttempts(@Param("id") String id);
}
