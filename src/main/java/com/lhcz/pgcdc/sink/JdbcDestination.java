package com.lhcz.pgcdc.sink;

import com.lhcz.pgcdc.error.ApplyException;
import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基于 JDBC 的目标端，目标库需支持 MERGE INTO (Databricks SQL、PostgreSQL 15+ 等)
 * <p>
 * 源表 schema.name 落到目标端的 [catalog.]schema.name。进度表与锁表也建在同一个 schema 下，
 * 这样数据和进度可以一起恢复。
 */
public class JdbcDestination implements Destination {
    private static final Logger log = LoggerFactory.getLogger(JdbcDestination.class);

    static final String CHECKPOINT_TABLE = "_cdc_checkpoints";
    static final String LOCK_TABLE = "_cdc_locks";

    private final DataSource ds;
    private final SqlDialect dialect;
    private final String catalog;
    private final String schema;

    public JdbcDestination(DataSource ds, SqlDialect dialect, String catalog, String schema) {
        this.ds = ds;
        this.dialect = dialect;
        this.catalog = (catalog != null && !catalog.isBlank()) ? catalog : null;
        this.schema = schema;
    }

    /**
     * 建好进度表与锁表
     */
    public void init() {
        String text = dialect.textType();
        execute("CREATE SCHEMA IF NOT EXISTS " + schemaName());
        execute("CREATE TABLE IF NOT EXISTS " + qualified(CHECKPOINT_TABLE) + " ("
                + "slot_name " + text + " NOT NULL, scope " + text + " NOT NULL, lsn BIGINT NOT NULL, seq INT NOT NULL, "
                + "updated_at " + dialect.timestampType() + dialect.primaryKeyClause(List.of("slot_name", "scope")) + ")");
        execute("CREATE TABLE IF NOT EXISTS " + qualified(LOCK_TABLE) + " ("
                + "lock_name " + text + " NOT NULL, owner " + text + " NOT NULL, acquired_at " + dialect.timestampType()
                + dialect.primaryKeyClause(List.of("lock_name")) + ")");
        log.info("目标端已就绪: schema={}", schemaName());
    }

    @Override
    public Optional<Map<String, LogicalType>> columns(TableId table) {
        try (Connection conn = ds.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            Map<String, LogicalType> columns = new LinkedHashMap<>();
            String escape = meta.getSearchStringEscape();
            try (ResultSet rs = meta.getColumns(catalog, likeLiteral(schema, escape), likeLiteral(table.name(), escape), null)) {
                while (rs.next()) {
                    String name = rs.getString("COLUMN_NAME");
                    String typeName = rs.getString("TYPE_NAME");
                    LogicalType type = dialect.fromTypeName(typeName);
                    if (type == null) {
                        log.warn("目标表 {} 列 {} 的类型 {} 无法识别，跳过类型校验", table.name(), name, typeName);
                    }
                    columns.put(name, type);
                }
            }
            return columns.isEmpty() ? Optional.empty() : Optional.of(columns);
        } catch (SQLException e) {
            throw new ApplyException("读取目标表结构失败: " + table.name(), e);
        }
    }

    @Override
    public void createTable(TableId table, List<ColumnDescriptor> columns) {
        String body = columns.stream()
                .map(c -> dialect.quote(c.name()) + " " + dialect.sqlType(c) + (c.primaryKey() ? " NOT NULL" : ""))
                .collect(Collectors.joining(", "));
        List<String> keys = columns.stream().filter(ColumnDescriptor::primaryKey).map(ColumnDescriptor::name).toList();
        execute("CREATE TABLE IF NOT EXISTS " + target(table) + " (" + body + dialect.primaryKeyClause(keys) + ")"
                + dialect.tableOptions());
        log.info("已创建目标表 {} ({} 列)", target(table), columns.size());
    }

    @Override
    public void addColumns(TableId table, List<ColumnDescriptor> columns) {
        execute(dialect.addColumnsSql(target(table), columns));
        log.info("目标表 {} 新增列: {}", target(table), columns.stream().map(ColumnDescriptor::name).toList());
    }

    @Override
    public void widenColumn(TableId table, ColumnDescriptor column) {
        execute(dialect.alterColumnTypeSql(target(table), column));
        log.info("目标表 {} 列 {} 类型放宽为 {}", target(table), column.name(), dialect.sqlType(column));
    }

    @Override
    public LogicalType storageType(LogicalType sourceType) {
        return dialect.storageType(sourceType);
    }

    @Override
    public void merge(MergePlan plan) {
        Map<String, ColumnDescriptor> byName = new LinkedHashMap<>();
        for (ColumnDescriptor column : plan.columns()) {
            byName.put(column.name(), column);
        }
        String target = target(plan.table());

        try (Connection conn = ds.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                if (plan.truncate()) {
                    try (Statement st = conn.createStatement()) {
                        st.executeUpdate("DELETE FROM " + target);
                    }
                }
                if (!plan.deletes().isEmpty()) {
                    executeDeletes(conn, target, plan, byName);
                }
                if (!plan.upserts().isEmpty()) {
                    executeUpserts(conn, target, plan, byName);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new ApplyException("写入目标表 " + target + " 失败: " + e.getMessage(), e);
        }
    }

    private void executeDeletes(Connection conn, String target, MergePlan plan, Map<String, ColumnDescriptor> byName)
            throws SQLException {
        String where = plan.keyColumns().stream()
                .map(k -> dialect.quote(k) + " = " + dialect.placeholder(byName.get(k)))
                .collect(Collectors.joining(" AND "));
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + target + " WHERE " + where)) {
            for (List<Object> key : plan.deletes()) {
                for (int i = 0; i < key.size(); i++) {
                    dialect.bind(ps, i + 1, byName.get(plan.keyColumns().get(i)), key.get(i));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /**
     * 行里缺失的列 (未变更的 TOAST 值) 不能覆盖目标端，所以按列集合分组，每组一条 MERGE
     */
    private void executeUpserts(Connection conn, String target, MergePlan plan, Map<String, ColumnDescriptor> byName)
            throws SQLException {
        Map<List<String>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : plan.upserts()) {
            List<String> columns = new ArrayList<>();
            for (String name : byName.keySet()) {
                if (row.containsKey(name)) {
                    columns.add(name);
                }
            }
            groups.computeIfAbsent(columns, k -> new ArrayList<>()).add(row);
        }

        for (Map.Entry<List<String>, List<Map<String, Object>>> group : groups.entrySet()) {
            List<String> columns = group.getKey();
            try (PreparedStatement ps = conn.prepareStatement(mergeSql(target, plan.keyColumns(), columns, byName))) {
                for (Map<String, Object> row : group.getValue()) {
                    for (int i = 0; i < columns.size(); i++) {
                        String name = columns.get(i);
                        dialect.bind(ps, i + 1, byName.get(name), row.get(name));
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }
    }

    String mergeSql(String target, List<String> keyColumns, List<String> columns, Map<String, ColumnDescriptor> byName) {
        String select = columns.stream()
                .map(c -> dialect.placeholder(byName.get(c)) + " AS " + dialect.quote(c))
                .collect(Collectors.joining(", "));
        String on = keyColumns.stream()
                .map(k -> "t." + dialect.quote(k) + " = s." + dialect.quote(k))
                .collect(Collectors.joining(" AND "));
        List<String> nonKey = columns.stream().filter(c -> !keyColumns.contains(c)).toList();

        StringBuilder sql = new StringBuilder()
                .append("MERGE INTO ").append(target).append(" AS t USING (SELECT ").append(select).append(") AS s ON ")
                .append(on);
        if (!nonKey.isEmpty()) {
            sql.append(" WHEN MATCHED THEN UPDATE SET ")
                    .append(nonKey.stream().map(c -> dialect.quote(c) + " = s." + dialect.quote(c))
                            .collect(Collectors.joining(", ")));
        }
        sql.append(" WHEN NOT MATCHED THEN INSERT (").append(dialect.quoteAll(columns)).append(") VALUES (")
                .append(columns.stream().map(c -> "s." + dialect.quote(c)).collect(Collectors.joining(", ")))
                .append(")");
        return sql.toString();
    }

    @Override
    public long rowCount(TableId table) {
        try (Connection conn = ds.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + target(table))) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new ApplyException("统计目标表行数失败: " + table.name(), e);
        }
    }

    @Override
    public Map<String, StreamPosition> readCheckpoints(String slotName) {
        String sql = "SELECT scope, lsn, seq FROM " + qualified(CHECKPOINT_TABLE) + " WHERE slot_name = ?";
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, slotName);
            Map<String, StreamPosition> result = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString(1), new StreamPosition(rs.getLong(2), rs.getInt(3)));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new ApplyException("读取进度失败: slot=" + slotName, e);
        }
    }

    @Override
    public void writeCheckpoint(String slotName, String scope, StreamPosition position) {
        String delete = "DELETE FROM " + qualified(CHECKPOINT_TABLE) + " WHERE slot_name = ? AND scope = ?";
        String insert = "INSERT INTO " + qualified(CHECKPOINT_TABLE) + " (slot_name, scope, lsn, seq, updated_at) VALUES (?, ?, ?, ?, ?)";
        try (Connection conn = ds.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement del = conn.prepareStatement(delete);
                 PreparedStatement ins = conn.prepareStatement(insert)) {
                del.setString(1, slotName);
                del.setString(2, scope);
                del.executeUpdate();
                ins.setString(1, slotName);
                ins.setString(2, scope);
                ins.setLong(3, position.lsn());
                ins.setInt(4, position.sequence());
                ins.setTimestamp(5, Timestamp.from(Instant.now()));
                ins.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new ApplyException("保存进度失败: " + scope + "=" + position, e);
        }
    }

    /**
     * 单条 MERGE 抢锁，再回读持有者。并发抢锁时落败的一方可能收到主键冲突 (PostgreSQL)
     * 或并发写入冲突 (Delta)，都以回读结果为准。
     */
    @Override
    public boolean tryLock(String lockName, String owner) {
        try (Connection conn = ds.getConnection()) {
            SQLException acquireError = null;
            try (PreparedStatement ps = conn.prepareStatement(lockMergeSql())) {
                ps.setString(1, lockName);
                ps.setString(2, owner);
                ps.setTimestamp(3, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            } catch (SQLException e) {
                log.warn("抢锁 {} 未成功 ({}): {}，以回读结果为准", lockName, e.getSQLState(), e.getMessage());
                acquireError = e;
            }
            String holder = lockOwner(conn, lockName);
            if (holder == null && acquireError != null) {
                throw new ApplyException("获取锁失败: " + lockName, acquireError, false);
            }
            return owner.equals(holder);
        } catch (SQLException e) {
            throw new ApplyException("获取锁失败: " + lockName, e, false);
        }
    }

    String lockMergeSql() {
        String text = dialect.textType();
        return "MERGE INTO " + qualified(LOCK_TABLE) + " AS t USING (SELECT CAST(? AS " + text + ") AS lock_name, "
                + "CAST(? AS " + text + ") AS owner, CAST(? AS " + dialect.timestampType() + ") AS acquired_at) AS s "
                + "ON t.lock_name = s.lock_name "
                + "WHEN NOT MATCHED THEN INSERT (lock_name, owner, acquired_at) VALUES (s.lock_name, s.owner, s.acquired_at)";
    }

    private String lockOwner(Connection conn, String lockName) throws SQLException {
        String select = "SELECT owner FROM " + qualified(LOCK_TABLE) + " WHERE lock_name = ?";
        try (PreparedStatement ps = conn.prepareStatement(select)) {
            ps.setString(1, lockName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    @Override
    public void unlock(String lockName, String owner) {
        String delete = "DELETE FROM " + qualified(LOCK_TABLE) + " WHERE lock_name = ? AND owner = ?";
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(delete)) {
            ps.setString(1, lockName);
            ps.setString(2, owner);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ApplyException("释放锁失败: " + lockName, e, false);
        }
    }

    @Override
    public void close() {
        if (ds instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("关闭目标端连接池失败: {}", e.getMessage());
            }
        }
    }

    String target(TableId table) {
        return qualified(table.name());
    }

    private String qualified(String table) {
        return schemaName() + "." + dialect.quote(table);
    }

    private String schemaName() {
        return catalog == null ? dialect.quote(schema) : dialect.quote(catalog) + "." + dialect.quote(schema);
    }

    private void execute(String sql) {
        try (Connection conn = ds.getConnection();
             Statement st = conn.createStatement()) {
            log.debug("[SQL] {}", sql);
            st.execute(sql);
        } catch (SQLException e) {
            throw new ApplyException("执行 DDL 失败: " + sql, e);
        }
    }

    /**
     * getColumns 的 schema/表名参数是 LIKE 模式，'_' 和 '%' 需要转义才能精确匹配
     */
    static String likeLiteral(String name, String escape) {
        if (name == null || escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%", escape + "%");
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }
}
