package com.lhcz.pgcdc.support;

import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.RelationDescriptor;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 常用的表结构与记录
 */
public final class Fixtures {

    public static final TableId USERS = new TableId("public", "users");
    public static final TableId ORDERS = new TableId("public", "orders");
    public static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    /** users(id int4 pk, name text) */
    public static final RelationDescriptor USERS_V1 = new RelationDescriptor(16384, USERS, 'd', List.of(
            ColumnDescriptor.of("id", LogicalType.INTEGER, true),
            ColumnDescriptor.of("name", LogicalType.TEXT, false)));

    /** users(id, name, email) */
    public static final RelationDescriptor USERS_V2 = new RelationDescriptor(16384, USERS, 'd', List.of(
            ColumnDescriptor.of("id", LogicalType.INTEGER, true),
            ColumnDescriptor.of("name", LogicalType.TEXT, false),
            ColumnDescriptor.of("email", LogicalType.TEXT, false)));

    /** orders(id int8 pk, amount numeric, note text) */
    public static final RelationDescriptor ORDERS_V1 = new RelationDescriptor(16390, ORDERS, 'd', List.of(
            ColumnDescriptor.of("id", LogicalType.BIGINT, true),
            ColumnDescriptor.of("amount", LogicalType.NUMERIC, false),
            ColumnDescriptor.of("note", LogicalType.TEXT, false)));

    private Fixtures() {
    }

    public static StreamPosition pos(long lsn, int sequence) {
        return new StreamPosition(lsn, sequence);
    }

    public static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    public static ChangeRecord insert(RelationDescriptor relation, StreamPosition position, Object... keyValues) {
        return ChangeRecord.insert(relation, row(keyValues), T0, position);
    }

    public static ChangeRecord update(RelationDescriptor relation, StreamPosition position, Object... keyValues) {
        return ChangeRecord.update(relation, null, row(keyValues), T0, position);
    }

    public static ChangeRecord delete(RelationDescriptor relation, StreamPosition position, Object... keyValues) {
        return ChangeRecord.delete(relation, row(keyValues), T0, position);
    }

    public static ChangeRecord truncate(RelationDescriptor relation, StreamPosition position) {
        return ChangeRecord.truncate(relation, T0, position);
    }
}
