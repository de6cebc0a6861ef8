package com.lhcz.pgcdc.model;

/**
 * 列定义
 *
 * @param name         列名
 * @param type         逻辑类型
 * @param typeOid      源端类型 OID
 * @param typeModifier 源端 atttypmod (-1 表示无)
 * @param primaryKey   是否属于复制标识 (主键)
 */
public record ColumnDescriptor(String name, LogicalType type, int typeOid, int typeModifier, boolean primaryKey) {

    public static ColumnDescriptor of(String name, LogicalType type, boolean primaryKey) {
        return new ColumnDescriptor(name, type, type.defaultOid(), -1, primaryKey);
    }

    /**
     * numeric(p,s) 的精度，未声明时返回 -1
     */
    public int numericPrecision() {
        if (type != LogicalType.NUMERIC || typeModifier < 4) {
            return -1;
        }
        return ((typeModifier - 4) >> 16) & 0xFFFF;
    }

    public int numericScale() {
        if (type != LogicalType.NUMERIC || typeModifier < 4) {
            return -1;
        }
        return (typeModifier - 4) & 0xFFFF;
    }
}
