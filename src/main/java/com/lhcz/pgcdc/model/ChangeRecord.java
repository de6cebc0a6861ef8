package com.lhcz.pgcdc.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一条归一化后的行变更，构造后不可变。
 *
 * @param table      源表
 * @param operation  操作类型
 * @param before     变更前镜像 (update/delete 时可能存在；可能只含主键列)
 * @param after      变更后镜像 (insert/update)
 * @param commitTime 所属事务提交时间
 * @param position   在复制流中的位置
 * @param relation   解码该事件时使用的表结构
 * @param truncate   true 表示 TRUNCATE 产生的整表删除标记 (operation=DELETE，无镜像、无主键)
 */
public record ChangeRecord(TableId table,
                           Operation operation,
                           Map<String, Object> before,
                           Map<String, Object> after,
                           Instant commitTime,
                           StreamPosition position,
                           RelationDescriptor relation,
                           boolean truncate) {

    public ChangeRecord {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(position, "position");
        before = before == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(before));
        after = after == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(after));
    }

    public static ChangeRecord insert(RelationDescriptor relation, Map<String, Object> after,
                                      Instant commitTime, StreamPosition position) {
        return new ChangeRecord(relation.table(), Operation.INSERT, null, after, commitTime, position, relation, false);
    }

    public static ChangeRecord update(RelationDescriptor relation, Map<String, Object> before, Map<String, Object> after,
                                      Instant commitTime, StreamPosition position) {
        return new ChangeRecord(relation.table(), Operation.UPDATE, before, after, commitTime, position, relation, false);
    }

    public static ChangeRecord delete(RelationDescriptor relation, Map<String, Object> before,
                                      Instant commitTime, StreamPosition position) {
        return new ChangeRecord(relation.table(), Operation.DELETE, before, null, commitTime, position, relation, false);
    }

    public static ChangeRecord truncate(RelationDescriptor relation, Instant commitTime, StreamPosition position) {
        return new ChangeRecord(relation.table(), Operation.DELETE, null, null, commitTime, position, relation, true);
    }

    /**
     * 主键值：insert/update 取变更后镜像，delete 取变更前镜像。truncate 标记没有主键。
     */
    public List<Object> key() {
        if (truncate) {
            return null;
        }
        return keyOf(operation == Operation.DELETE ? before : after);
    }

    /**
     * update 改了主键时，变更前的主键；否则为 null
     */
    public List<Object> previousKey() {
        if (operation != Operation.UPDATE || before == null) {
            return null;
        }
        List<Object> old = keyOf(before);
        List<Object> current = key();
        if (old == null || (current != null && Arrays.deepEquals(old.toArray(), current.toArray()))) {
            return null;
        }
        return old;
    }

    private List<Object> keyOf(Map<String, Object> image) {
        if (image == null) {
            return null;
        }
        List<Object> values = new ArrayList<>();
        for (String column : relation.keyColumnNames()) {
            if (!image.containsKey(column)) {
                return null;
            }
            values.add(image.get(column));
        }
        return values;
    }
}
