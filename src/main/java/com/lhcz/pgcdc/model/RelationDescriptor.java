package com.lhcz.pgcdc.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 源表结构快照。由 Relation 消息整体替换，使用方只读。
 *
 * @param relationId      源端关系 OID
 * @param table           表标识
 * @param replicaIdentity 复制标识 (d=default, n=nothing, f=full, i=index)
 * @param columns         列定义，顺序与行镜像中的位置一致
 */
public record RelationDescriptor(int relationId, TableId table, char replicaIdentity, List<ColumnDescriptor> columns) {

    public RelationDescriptor {
        columns = List.copyOf(columns);
    }

    public List<ColumnDescriptor> keyColumns() {
        List<ColumnDescriptor> keys = new ArrayList<>();
        for (ColumnDescriptor column : columns) {
            if (column.primaryKey()) {
                keys.add(column);
            }
        }
        return keys;
    }

    public List<String> keyColumnNames() {
        List<String> names = new ArrayList<>();
        for (ColumnDescriptor column : keyColumns()) {
            names.add(column.name());
        }
        return names;
    }

    public Optional<ColumnDescriptor> column(String name) {
        for (ColumnDescriptor column : columns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
