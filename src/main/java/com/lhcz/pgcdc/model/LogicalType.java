package com.lhcz.pgcdc.model;

import com.lhcz.pgcdc.error.DecodeException;

import java.util.HashMap;
import java.util.Map;

/**
 * 列的逻辑类型，由 PostgreSQL 类型 OID 映射而来
 */
public enum LogicalType {
    BOOLEAN(16),
    SMALLINT(21),
    INTEGER(23),
    BIGINT(20, 26),
    REAL(700),
    DOUBLE(701),
    NUMERIC(1700),
    TEXT(25, 1043, 1042, 19, 18),
    DATE(1082),
    TIME(1083),
    TIMESTAMP(1114),
    TIMESTAMPTZ(1184),
    UUID(2950),
    JSON(114, 3802),
    BYTES(17);

    private static final Map<Integer, LogicalType> BY_OID = new HashMap<>();

    static {
        for (LogicalType type : values()) {
            for (int oid : type.oids) {
                BY_OID.put(oid, type);
            }
        }
    }

    private final int[] oids;

    LogicalType(int... oids) {
        this.oids = oids;
    }

    public static LogicalType fromOid(int oid) {
        LogicalType type = BY_OID.get(oid);
        if (type == null) {
            throw new DecodeException("不支持的列类型 OID: " + oid);
        }
        return type;
    }

    public int defaultOid() {
        return oids[0];
    }

    public static boolean isSupported(int oid) {
        return BY_OID.containsKey(oid);
    }

    /**
     * 整数/浮点族内的宽度序，用于区分 "收窄" 与 "不兼容"；非数值类型返回 -1
     */
    public int numericRank() {
        return switch (this) {
            case SMALLINT -> 1;
            case INTEGER -> 2;
            case BIGINT -> 3;
            case REAL -> 4;
            case DOUBLE -> 5;
            case NUMERIC -> 6;
            default -> -1;
        };
    }

    /**
     * 数值族内由窄变宽 (如 INTEGER -> BIGINT)，目标列可以直接放宽
     */
    public boolean widensTo(LogicalType wider) {
        return numericRank() >= 0 && wider.numericRank() > numericRank();
    }
}
