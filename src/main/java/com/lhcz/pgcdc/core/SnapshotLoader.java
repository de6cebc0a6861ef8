package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.error.ConnectionException;
import com.lhcz.pgcdc.error.SchemaConflictException;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.RelationDescriptor;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.sink.Destination;
import com.lhcz.pgcdc.source.ReplicationSetup;
import com.lhcz.pgcdc.wal.ValueDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全量加载 (回填)
 * 按主键分页读取源表 (keyset 分页，WHERE (k) > (?) ORDER BY k LIMIT ?)，逐页交给写入器。
 * 第一页带整表清空标记，即目标表被整体替换。
 * 完成后记录回填标记，位置取开始复制前读到的 WAL 位置；复制槽必须在此之前已经存在，
 * 之后的增量从复制槽重放，与快照合并后收敛。
 */
public class SnapshotLoader {
    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final String COLUMNS_SQL = """
            SELECT c.oid, a.attname, a.atttypid, a.atttypmod,
                   EXISTS (SELECT 1 FROM pg_index i
                           WHERE i.indrelid = c.oid AND i.indisprimary AND a.attnum = ANY (i.indkey)) AS pk
            FROM pg_attribute a
            JOIN pg_class c ON c.oid = a.attrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ? AND c.relname = ? AND a.attnum > 0 AND NOT a.attisdropped
            ORDER BY a.attnum
            """;

    private final DataSource ds;
    private final ReplicationSetup setup;
    private final MergeLoader mergeLoader;
    private final Destination destination;
    private final CheckpointManager checkpointManager;
    private final int pageSize;

    public SnapshotLoader(DataSource ds, ReplicationSetup setup, MergeLoader mergeLoader, Destination destination,
                          CheckpointManager checkpointManager, int pageSize) {
        this.ds = ds;
        this.setup = setup;
        this.mergeLoader = mergeLoader;
        this.destination = destination;
        this.checkpointManager = checkpointManager;
        this.pageSize = pageSize;
    }

    /**
     * 全量同步所有表
     */
    public void loadAll(List<TableId> tables) {
        setup.ensurePublication(tables);
        setup.ensureSlot();
        for (TableId table : tables) {
            load(table);
        }
        log.info("🎉 全量同步完成，共 {} 张表", tables.size());
    }

    /**
     * 全量同步一张表
     *
     * @return 读取的行数
     */
    public long load(TableId table) {
        long startLsn = setup.currentWalLsn();
        RelationDescriptor relation = describe(table);
        List<ColumnDescriptor> keys = relation.keyColumns();
        if (keys.isEmpty()) {
            throw new SchemaConflictException(table, "(primary key)", "表没有主键，无法分页全量同步");
        }
        log.info("任务 [{}] 开始全量同步，起始 WAL 位置 {}", table, StreamPosition.endOf(startLsn).lsnString());

        Instant snapshotTime = Instant.now();
        int sequence = 0;
        StreamPosition previous = StreamPosition.BEGINNING;
        List<Object> lastKey = null;
        long total = 0;
        long startTime = System.currentTimeMillis();

        while (true) {
            List<ChangeRecord> records = new ArrayList<>();
            if (lastKey == null) {
                // 第一页先清空目标表
                records.add(ChangeRecord.truncate(relation, snapshotTime, new StreamPosition(startLsn, ++sequence)));
            }
            List<Map<String, Object>> rows = readPage(relation, keys, lastKey);
            for (Map<String, Object> row : rows) {
                records.add(ChangeRecord.insert(relation, row, snapshotTime, new StreamPosition(startLsn, ++sequence)));
            }
            if (records.isEmpty()) {
                break;
            }

            StreamPosition high = records.get(records.size() - 1).position();
            mergeLoader.apply(new Batch(table, records, previous, high));
            previous = high;
            total += rows.size();

            if (rows.size() < pageSize) {
                break;
            }
            Map<String, Object> last = rows.get(rows.size() - 1);
            lastKey = keys.stream().map(k -> last.get(k.name())).toList();
            log.info("任务 [{}] 已同步 {} 条数据...", table, total);
        }

        long stored = destination.rowCount(table);
        if (stored != total) {
            // 全量期间源表仍在写入时行数可能不同，之后的增量会补齐
            log.warn("⚠️ 任务 [{}] 目标表行数 {} 与读取行数 {} 不一致", table, stored, total);
        }
        checkpointManager.markBackfilled(table, StreamPosition.endOf(startLsn));
        log.info("✅ 任务 [{}] 全量同步完成，共 {} 条，耗时 {}ms", table, total, System.currentTimeMillis() - startTime);
        return total;
    }

    /**
     * 从系统目录读取表结构与主键
     */
    RelationDescriptor describe(TableId table) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        int relationId = 0;
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, table.schema());
            ps.setString(2, table.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    relationId = (int) rs.getLong(1);
                    int typeOid = (int) rs.getLong(3);
                    columns.add(new ColumnDescriptor(rs.getString(2), LogicalType.fromOid(typeOid), typeOid,
                            rs.getInt(4), rs.getBoolean(5)));
                }
            }
        } catch (SQLException e) {
            throw new ConnectionException("读取表结构失败: " + table, e);
        }
        if (columns.isEmpty()) {
            throw new IllegalStateException("源表不存在或没有列: " + table);
        }
        return new RelationDescriptor(relationId, table, 'd', columns);
    }

    private List<Map<String, Object>> readPage(RelationDescriptor relation, List<ColumnDescriptor> keys, List<Object> lastKey) {
        String columns = relation.columns().stream().map(c -> quote(c.name())).collect(Collectors.joining(", "));
        String keyList = keys.stream().map(k -> quote(k.name())).collect(Collectors.joining(", "));
        String placeholders = keys.stream().map(k -> "?").collect(Collectors.joining(", "));
        String from = quote(relation.table().schema()) + "." + quote(relation.table().name());

        // 示例: SELECT ... FROM "public"."users" WHERE ("id") > (?) ORDER BY "id" LIMIT ?
        String sql = "SELECT " + columns + " FROM " + from
                + (lastKey == null ? "" : " WHERE (" + keyList + ") > (" + placeholders + ")")
                + " ORDER BY " + keyList + " LIMIT ?";

        List<Map<String, Object>> rows = new ArrayList<>();
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            if (lastKey != null) {
                for (Object value : lastKey) {
                    ps.setObject(index++, value);
                }
            }
            ps.setInt(index, pageSize);
            log.debug("[SQL] {}", sql);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (ColumnDescriptor column : relation.columns()) {
                        String text = rs.getString(column.name());
                        row.put(column.name(), text == null ? null : ValueDecoder.decodeText(column, text));
                    }
                    rows.add(row);
                }
            }
        } catch (SQLException e) {
            throw new ConnectionException("分页读取 " + relation.table() + " 失败: " + e.getMessage(), e);
        }
        return rows;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
