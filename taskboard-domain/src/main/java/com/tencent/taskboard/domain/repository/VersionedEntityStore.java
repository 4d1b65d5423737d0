package com.tencent.taskboard.domain.repository;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.Optional;

/**
 * VersionedEntityStore - 带版本号的条件更新仓储
 * <p>
 * 所有并发敏感的写操作都通过单条条件 UPDATE 完成：
 * {@code UPDATE ... SET ..., version = version + 1 WHERE id = ? AND version = ?}
 * </p>
 *
 * @param <T> 实体类型
 * @param <M> 变更描述类型
 * @author taskboard
 */
public interface VersionedEntityStore<T, M> {

    /**
     * 在版本号匹配时应用变更，版本号加一
     *
     * @param id 实体 ID
     * @param expectedVersion 调用方读到的版本号
     * @param mutation 要写入的字段
     * @return 更新后的实体；行不存在、版本已过期或被并发修改时返回空，三种情况不做区分
     */
    Optional<T> updateIfVersion(@Positive long id, @Min(1) int expectedVersion, @NotNull M mutation);
}
