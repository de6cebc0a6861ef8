package com.lhcz.pgcdc.sink;

import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 目标端 (分析型存储)
 * <p>
 * 所有方法以源表标识寻址，由实现决定落到目标端哪个 schema。失败时抛出
 * {@link com.lhcz.pgcdc.error.ApplyException}，由调用方决定是否重试。
 */
public interface Destination extends AutoCloseable {

    /**
     * 目标表当前的列 (按目标端存储类型)，表不存在时返回 empty
     */
    Optional<Map<String, LogicalType>> columns(TableId table);

    void createTable(TableId table, List<ColumnDescriptor> columns);

    /**
     * 追加可空列
     */
    void addColumns(TableId table, List<ColumnDescriptor> columns);

    /**
     * 把已有列放宽为 column 的类型 (只用于数值族内由窄变宽)
     */
    void widenColumn(TableId table, ColumnDescriptor column);

    /**
     * 源端类型在目标端实际存储成的类型，例如某些仓库没有 uuid 类型会存成文本
     */
    default LogicalType storageType(LogicalType sourceType) {
        return sourceType;
    }

    /**
     * 原子执行一个批次：要么全部生效，要么全部不生效
     */
    void merge(MergePlan plan);

    long rowCount(TableId table);

    /**
     * scope -> 位置
     */
    Map<String, StreamPosition> readCheckpoints(String slotName);

    void writeCheckpoint(String slotName, String scope, StreamPosition position);

    /**
     * 获取互斥锁，已被其他 owner 持有时返回 false
     */
    boolean tryLock(String lockName, String owner);

    void unlock(String lockName, String owner);

    @Override
    void close();
}
