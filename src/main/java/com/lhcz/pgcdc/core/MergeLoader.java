package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.error.ApplyException;
import com.lhcz.pgcdc.error.ReplicationException;
import com.lhcz.pgcdc.error.SchemaConflictException;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.RelationDescriptor;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.model.UnchangedToast;
import com.lhcz.pgcdc.sink.Destination;
import com.lhcz.pgcdc.sink.MergePlan;
import com.lhcz.pgcdc.sink.StagedBatch;
import com.lhcz.pgcdc.sink.StagingArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 批次写入器
 * <p>
 * 流程：结构演进 (只追加列) -> 折叠 (同一主键只保留最后一次写入) -> 暂存 -> 原子 MERGE。
 * 写入失败按线性退避重试，重试耗尽后转储批次并抛出致命异常。
 * 同一批次重复写入结果不变，所以重连后的重放是安全的。
 */
public class MergeLoader {
    private static final Logger log = LoggerFactory.getLogger(MergeLoader.class);

    private final Destination destination;
    private final StagingArea staging;
    private final AppConfig.ApplyConfig config;
    private final DeadLetterQueueManager deadLetterQueueManager;

    // 目标表结构缓存，写入失败时作废
    private final Map<TableId, Map<String, LogicalType>> knownColumns = new ConcurrentHashMap<>();

    public MergeLoader(Destination destination, StagingArea staging, AppConfig.ApplyConfig config,
                       DeadLetterQueueManager deadLetterQueueManager) {
        this.destination = destination;
        this.staging = staging;
        this.config = config;
        this.deadLetterQueueManager = deadLetterQueueManager;
    }

    /**
     * 写入一个批次
     *
     * @return 批次上界，调用方据此推进表进度
     */
    public StreamPosition apply(Batch batch) {
        if (batch.isEmpty()) {
            return batch.high();
        }
        int maxAttempts = config.maxRetriesOrDefault() + 1;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                long start = System.currentTimeMillis();
                MergePlan plan = prepare(batch);
                StagedBatch staged = staging.stage(plan);
                if (!plan.isNoop()) {
                    destination.merge(plan);
                }
                staging.discard(staged);
                log.info("✅ 批次写入 [{}] ({}, {}] 记录 {} 条 -> 删除 {} / 写入 {}{}，耗时 {}ms",
                        batch.table(), batch.low(), batch.high(), batch.size(), plan.deletes().size(),
                        plan.upserts().size(), plan.truncate() ? " (含清空)" : "", System.currentTimeMillis() - start);
                return batch.high();
            } catch (ReplicationException e) {
                knownColumns.remove(batch.table());
                if (!e.isRetriable()) {
                    log.error("❌ [{}] 批次写入遇到不可重试的错误: {}", batch.table(), e.getMessage());
                    deadLetterQueueManager.save(batch, e.getClass().getSimpleName());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("❌ [{}] 重试耗尽，批次 ({}, {}] 写入失败! 转储后停止。", batch.table(), batch.low(), batch.high());
                    deadLetterQueueManager.save(batch, "Exhausted_" + e.getClass().getSimpleName());
                    throw e instanceof ApplyException ae ? ae.exhausted(attempt)
                            : new ApplyException("重试 " + attempt + " 次后仍然失败: " + e.getMessage(), e, false);
                }
                log.warn("⚠️ [{}] 写入异常，正在重试 {}/{} ... {}", batch.table(), attempt, maxAttempts - 1, e.getMessage());
                backoff(attempt, e);
            }
        }
    }

    /**
     * 结构演进 + 折叠，得到写入计划
     */
    MergePlan prepare(Batch batch) {
        List<ColumnDescriptor> columns = evolveSchema(batch);
        RelationDescriptor latest = batch.records().get(batch.size() - 1).relation();
        List<String> keyColumns = latest.keyColumnNames();
        boolean keyed = batch.records().stream().anyMatch(r -> !r.truncate());
        if (keyed && keyColumns.isEmpty()) {
            throw new SchemaConflictException(batch.table(), "(primary key)", "表没有主键或复制标识，无法按键合并");
        }
        return collapse(batch, keyColumns, columns);
    }

    /**
     * 对比批次中出现过的所有表结构版本与目标表：缺表则建表，缺列则追加可空列，数值类型变宽则放宽目标列，收窄或不兼容则冲突。
     * 源端删除的列在目标端保留。
     *
     * @return 批次内所有版本的列并集 (按首次出现顺序)
     */
    List<ColumnDescriptor> evolveSchema(Batch batch) {
        TableId table = batch.table();
        Map<String, ColumnDescriptor> union = new LinkedHashMap<>();
        Set<RelationDescriptor> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ChangeRecord record : batch.records()) {
            if (!seen.add(record.relation())) {
                continue;
            }
            for (ColumnDescriptor column : record.relation().columns()) {
                ColumnDescriptor previous = union.get(column.name());
                if (previous != null) {
                    LogicalType before = destination.storageType(previous.type());
                    LogicalType after = destination.storageType(column.type());
                    if (before != after && !before.widensTo(after)) {
                        throw conflict(table, column.name(), before, after);
                    }
                }
                union.put(column.name(), column);
            }
        }
        List<ColumnDescriptor> columns = new ArrayList<>(union.values());

        Map<String, LogicalType> existing = knownColumns.get(table);
        if (existing == null) {
            Optional<Map<String, LogicalType>> found = destination.columns(table);
            if (found.isEmpty()) {
                destination.createTable(table, columns);
                existing = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                for (ColumnDescriptor column : columns) {
                    existing.put(column.name(), destination.storageType(column.type()));
                }
                knownColumns.put(table, existing);
                return columns;
            }
            existing = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            existing.putAll(found.get());
        }

        List<ColumnDescriptor> missing = new ArrayList<>();
        for (ColumnDescriptor column : columns) {
            if (!existing.containsKey(column.name())) {
                missing.add(column);
                continue;
            }
            LogicalType stored = existing.get(column.name());
            LogicalType wanted = destination.storageType(column.type());
            // 无法识别的目标类型不做校验
            if (stored == null || stored == wanted) {
                continue;
            }
            if (!stored.widensTo(wanted)) {
                throw conflict(table, column.name(), stored, wanted);
            }
            destination.widenColumn(table, column);
            existing.put(column.name(), wanted);
        }
        if (!missing.isEmpty()) {
            destination.addColumns(table, missing);
            for (ColumnDescriptor column : missing) {
                existing.put(column.name(), destination.storageType(column.type()));
            }
        }
        knownColumns.put(table, existing);
        return columns;
    }

    private static SchemaConflictException conflict(TableId table, String column, LogicalType stored, LogicalType wanted) {
        boolean narrowing = stored.numericRank() >= 0 && wanted.numericRank() >= 0
                && wanted.numericRank() < stored.numericRank();
        return new SchemaConflictException(table, column,
                (narrowing ? "类型收窄 " : "类型不兼容 ") + stored + " -> " + wanted);
    }

    /**
     * 折叠批次：同一主键只保留最后一次写入；TRUNCATE 清掉它之前的所有变更；
     * 修改了主键的 UPDATE 会删除旧主键；未变更的 TOAST 列优先取本批次中更早的值，否则不写该列。
     */
    static MergePlan collapse(Batch batch, List<String> keyColumns, List<ColumnDescriptor> columns) {
        boolean truncate = false;
        // 折叠用可比较的主键，删除时仍绑定原始主键值
        Map<List<Object>, Map<String, Object>> state = new LinkedHashMap<>();
        Map<List<Object>, List<Object>> rawKeys = new HashMap<>();
        Map<String, Object> deleted = Collections.emptyMap();

        for (ChangeRecord record : batch.records()) {
            if (record.truncate()) {
                truncate = true;
                state.clear();
                rawKeys.clear();
                continue;
            }
            List<Object> key = comparable(record.key());
            rawKeys.put(key, record.key());
            switch (record.operation()) {
                case INSERT -> state.put(key, materialize(record.after(), upsertOf(state.get(key), deleted)));
                case UPDATE -> {
                    List<Object> previousKey = comparable(record.previousKey());
                    Map<String, Object> base;
                    if (previousKey != null && !previousKey.equals(key)) {
                        rawKeys.put(previousKey, record.previousKey());
                        base = upsertOf(state.get(previousKey), deleted);
                        state.put(previousKey, deleted);
                    } else {
                        base = upsertOf(state.get(key), deleted);
                    }
                    state.put(key, materialize(record.after(), base));
                }
                case DELETE -> state.put(key, deleted);
            }
        }

        List<List<Object>> deletes = new ArrayList<>();
        List<Map<String, Object>> upserts = new ArrayList<>();
        for (Map.Entry<List<Object>, Map<String, Object>> entry : state.entrySet()) {
            if (entry.getValue() == deleted) {
                deletes.add(rawKeys.get(entry.getKey()));
            } else {
                upserts.add(entry.getValue());
            }
        }
        return new MergePlan(batch.table(), keyColumns, columns, truncate, deletes, upserts, batch.low(), batch.high());
    }

    /**
     * bytea 主键解码为 byte[]，按引用比较，这里换成按内容比较的 ByteBuffer
     */
    static List<Object> comparable(List<Object> key) {
        if (key == null) {
            return null;
        }
        List<Object> values = new ArrayList<>(key.size());
        for (Object part : key) {
            values.add(part instanceof byte[] bytes ? ByteBuffer.wrap(bytes) : part);
        }
        return values;
    }

    private static Map<String, Object> upsertOf(Map<String, Object> row, Map<String, Object> deleted) {
        return row == deleted ? null : row;
    }

    private static Map<String, Object> materialize(Map<String, Object> after, Map<String, Object> base) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : after.entrySet()) {
            if (UnchangedToast.is(entry.getValue())) {
                if (base != null && base.containsKey(entry.getKey())) {
                    row.put(entry.getKey(), base.get(entry.getKey()));
                }
            } else {
                row.put(entry.getKey(), entry.getValue());
            }
        }
        return row;
    }

    private void backoff(int attempt, ReplicationException cause) {
        try {
            Thread.sleep(config.backoffMsOrDefault() * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ApplyException("等待重试时被中断", cause, false);
        }
    }
}
