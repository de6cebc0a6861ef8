package com.lhcz.pgcdc.sink;

import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 目标端 SQL 方言：类型映射、标识符引用与 DDL 差异
 */
public enum SqlDialect {

    POSTGRES('"') {
        @Override
        public String sqlType(ColumnDescriptor column) {
            return switch (column.type()) {
                case BOOLEAN -> "boolean";
                case SMALLINT -> "smallint";
                case INTEGER -> "integer";
                case BIGINT -> "bigint";
                case REAL -> "real";
                case DOUBLE -> "double precision";
                case NUMERIC -> column.numericPrecision() > 0
                        ? "numeric(" + column.numericPrecision() + "," + column.numericScale() + ")" : "numeric";
                case TEXT -> "text";
                case DATE -> "date";
                case TIME -> "time";
                case TIMESTAMP -> "timestamp";
                case TIMESTAMPTZ -> "timestamptz";
                case UUID -> "uuid";
                case JSON -> "jsonb";
                case BYTES -> "bytea";
            };
        }

        @Override
        public LogicalType fromTypeName(String typeName) {
            return switch (normalize(typeName)) {
                case "bool", "boolean" -> LogicalType.BOOLEAN;
                case "int2", "smallint" -> LogicalType.SMALLINT;
                case "int4", "integer", "serial" -> LogicalType.INTEGER;
                case "int8", "bigint", "bigserial", "oid" -> LogicalType.BIGINT;
                case "float4", "real" -> LogicalType.REAL;
                case "float8", "double precision" -> LogicalType.DOUBLE;
                case "numeric", "decimal" -> LogicalType.NUMERIC;
                case "text", "varchar", "bpchar", "name", "char" -> LogicalType.TEXT;
                case "date" -> LogicalType.DATE;
                case "time" -> LogicalType.TIME;
                case "timestamp" -> LogicalType.TIMESTAMP;
                case "timestamptz" -> LogicalType.TIMESTAMPTZ;
                case "uuid" -> LogicalType.UUID;
                case "json", "jsonb" -> LogicalType.JSON;
                case "bytea" -> LogicalType.BYTES;
                default -> null;
            };
        }

        @Override
        public String addColumnsSql(String table, List<ColumnDescriptor> columns) {
            return "ALTER TABLE " + table + " " + columns.stream()
                    .map(c -> "ADD COLUMN " + quote(c.name()) + " " + sqlType(c))
                    .collect(Collectors.joining(", "));
        }

        @Override
        public String alterColumnTypeSql(String table, ColumnDescriptor column) {
            return "ALTER TABLE " + table + " ALTER COLUMN " + quote(column.name()) + " TYPE " + sqlType(column);
        }

        @Override
        public String primaryKeyClause(List<String> keyColumns) {
            return keyColumns.isEmpty() ? "" : ", PRIMARY KEY (" + quoteAll(keyColumns) + ")";
        }

        @Override
        public String textType() {
            return "text";
        }

        @Override
        public String timestampType() {
            return "timestamptz";
        }
    },

    DATABRICKS('`') {
        @Override
        public String sqlType(ColumnDescriptor column) {
            return switch (column.type()) {
                case BOOLEAN -> "BOOLEAN";
                case SMALLINT -> "SMALLINT";
                case INTEGER -> "INT";
                case BIGINT -> "BIGINT";
                case REAL -> "FLOAT";
                case DOUBLE -> "DOUBLE";
                case NUMERIC -> column.numericPrecision() > 0
                        ? "DECIMAL(" + column.numericPrecision() + "," + column.numericScale() + ")" : "DECIMAL(38,10)";
                case TEXT, TIME, UUID, JSON -> "STRING";
                case DATE -> "DATE";
                case TIMESTAMP -> "TIMESTAMP_NTZ";
                case TIMESTAMPTZ -> "TIMESTAMP";
                case BYTES -> "BINARY";
            };
        }

        @Override
        public LogicalType fromTypeName(String typeName) {
            return switch (normalize(typeName)) {
                case "boolean" -> LogicalType.BOOLEAN;
                case "tinyint", "smallint" -> LogicalType.SMALLINT;
                case "int", "integer" -> LogicalType.INTEGER;
                case "bigint" -> LogicalType.BIGINT;
                case "float" -> LogicalType.REAL;
                case "double" -> LogicalType.DOUBLE;
                case "decimal" -> LogicalType.NUMERIC;
                case "string", "varchar", "char" -> LogicalType.TEXT;
                case "date" -> LogicalType.DATE;
                case "timestamp_ntz" -> LogicalType.TIMESTAMP;
                case "timestamp" -> LogicalType.TIMESTAMPTZ;
                case "binary" -> LogicalType.BYTES;
                default -> null;
            };
        }

        @Override
        public LogicalType storageType(LogicalType sourceType) {
            return switch (sourceType) {
                case TIME, UUID, JSON -> LogicalType.TEXT;
                default -> sourceType;
            };
        }

        @Override
        public String addColumnsSql(String table, List<ColumnDescriptor> columns) {
            return "ALTER TABLE " + table + " ADD COLUMNS (" + columns.stream()
                    .map(c -> quote(c.name()) + " " + sqlType(c))
                    .collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public String alterColumnTypeSql(String table, ColumnDescriptor column) {
            return "ALTER TABLE " + table + " ALTER COLUMN " + quote(column.name()) + " TYPE " + sqlType(column);
        }

        @Override
        public String tableOptions() {
            // 放宽列类型需要 Delta 的 type widening 特性
            return " TBLPROPERTIES ('delta.enableTypeWidening' = 'true')";
        }

        @Override
        public String primaryKeyClause(List<String> keyColumns) {
            // Delta 表的主键约束只是信息性的，键的唯一性由 MERGE 保证
            return "";
        }

        @Override
        public String textType() {
            return "STRING";
        }

        @Override
        public String timestampType() {
            return "TIMESTAMP";
        }
    };

    private final char quote;

    SqlDialect(char quote) {
        this.quote = quote;
    }

    public abstract String sqlType(ColumnDescriptor column);

    /**
     * 元数据里的类型名 -> 逻辑类型，无法识别时返回 null
     */
    public abstract LogicalType fromTypeName(String typeName);

    public abstract String addColumnsSql(String table, List<ColumnDescriptor> columns);

    public abstract String alterColumnTypeSql(String table, ColumnDescriptor column);

    public abstract String primaryKeyClause(List<String> keyColumns);

    /**
     * 追加在 CREATE TABLE (...) 之后的表选项
     */
    public String tableOptions() {
        return "";
    }

    public abstract String textType();

    public abstract String timestampType();

    public LogicalType storageType(LogicalType sourceType) {
        return sourceType;
    }

    public String quote(String identifier) {
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }

    public String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quote).collect(Collectors.joining(", "));
    }

    /**
     * 占位符统一带 CAST，保证 NULL 参数也能推断出类型
     */
    public String placeholder(ColumnDescriptor column) {
        return "CAST(? AS " + sqlType(column) + ")";
    }

    public void bind(PreparedStatement ps, int index, ColumnDescriptor column, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, jdbcType(column.type()));
            return;
        }
        if (value instanceof LocalDateTime ldt) {
            ps.setTimestamp(index, Timestamp.valueOf(ldt));
        } else if (value instanceof OffsetDateTime odt) {
            ps.setTimestamp(index, Timestamp.from(odt.toInstant()));
        } else if (value instanceof LocalDate date) {
            ps.setDate(index, java.sql.Date.valueOf(date));
        } else if (value instanceof LocalTime time) {
            ps.setString(index, time.toString());
        } else if (value instanceof UUID uuid) {
            ps.setString(index, uuid.toString());
        } else if (value instanceof byte[] bytes) {
            ps.setBytes(index, bytes);
        } else {
            ps.setObject(index, value);
        }
    }

    private static int jdbcType(LogicalType type) {
        return switch (type) {
            case BOOLEAN -> Types.BOOLEAN;
            case SMALLINT -> Types.SMALLINT;
            case INTEGER -> Types.INTEGER;
            case BIGINT -> Types.BIGINT;
            case REAL -> Types.REAL;
            case DOUBLE -> Types.DOUBLE;
            case NUMERIC -> Types.NUMERIC;
            case DATE -> Types.DATE;
            case TIMESTAMP, TIMESTAMPTZ -> Types.TIMESTAMP;
            case BYTES -> Types.BINARY;
            default -> Types.VARCHAR;
        };
    }

    private static String normalize(String typeName) {
        String name = typeName.toLowerCase(Locale.ROOT).trim();
        int paren = name.indexOf('(');
        return paren > 0 ? name.substring(0, paren).trim() : name;
    }
}
