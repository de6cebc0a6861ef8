package com.lhcz.pgcdc.source;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.error.ConnectionException;
import com.lhcz.pgcdc.model.TableId;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 源端准备工作：发现要同步的表，维护发布 (publication) 和逻辑复制槽
 */
public class ReplicationSetup {
    private static final Logger log = LoggerFactory.getLogger(ReplicationSetup.class);

    /** 引擎自己的表都以此开头，不参与同步 */
    public static final String INTERNAL_PREFIX = "_cdc";

    private static final String DUPLICATE_OBJECT = "42710";

    private final DataSource ds;
    private final AppConfig.ReplicationConfig config;

    public ReplicationSetup(DataSource ds, AppConfig.ReplicationConfig config) {
        this.ds = ds;
        this.config = config;
    }

    /**
     * 配置了表清单则按清单，否则自动发现 schema 下的所有普通表
     */
    public List<TableId> tables() {
        String schema = config.schemaOrDefault();
        if (config.tables() != null && !config.tables().isEmpty()) {
            return config.tables().stream().map(t -> TableId.parse(t, schema)).toList();
        }
        String sql = "SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = ? AND table_type = 'BASE TABLE' ORDER BY table_name";
        List<TableId> tables = new ArrayList<>();
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, schema);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString(1);
                    if (!name.startsWith(INTERNAL_PREFIX)) {
                        tables.add(new TableId(schema, name));
                    }
                }
            }
        } catch (SQLException e) {
            throw new ConnectionException("发现源表失败: " + e.getMessage(), e);
        }
        log.info("在 schema [{}] 下发现 {} 张表: {}", schema, tables.size(), tables);
        return tables;
    }

    /**
     * 发布不存在则创建，已存在则补齐缺少的表
     */
    public void ensurePublication(List<TableId> tables) {
        String publication = config.publicationNameOrDefault();
        if (tables.isEmpty()) {
            throw new IllegalStateException("没有需要同步的表，无法创建发布 " + publication);
        }
        try (Connection conn = ds.getConnection()) {
            Set<TableId> published = publishedTables(conn, publication);
            if (published == null) {
                execute(conn, "CREATE PUBLICATION " + quote(publication) + " FOR TABLE " + tableList(tables));
                log.info("📢 已创建发布 {}: {}", publication, tables);
                return;
            }
            List<TableId> missing = tables.stream().filter(t -> !published.contains(t)).toList();
            if (!missing.isEmpty()) {
                execute(conn, "ALTER PUBLICATION " + quote(publication) + " ADD TABLE " + tableList(missing));
                log.info("📢 发布 {} 新增表: {}", publication, missing);
            }
        } catch (SQLException e) {
            throw new ConnectionException("维护发布 " + publication + " 失败: " + e.getMessage(), e);
        }
    }

    /**
     * 复制槽不存在则创建 (pgoutput)
     *
     * @return 是否新建
     */
    public boolean ensureSlot() {
        String slot = config.slotNameOrDefault();
        try (Connection conn = ds.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM pg_replication_slots WHERE slot_name = ?")) {
                ps.setString(1, slot);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return false;
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("SELECT pg_create_logical_replication_slot(?, 'pgoutput')")) {
                ps.setString(1, slot);
                ps.execute();
            }
            log.info("🎰 已创建逻辑复制槽 {}", slot);
            return true;
        } catch (SQLException e) {
            // 并发创建时槽已存在
            if (DUPLICATE_OBJECT.equals(e.getSQLState())) {
                return false;
            }
            throw new ConnectionException("创建复制槽 " + slot + " 失败: " + e.getMessage(), e);
        }
    }

    /**
     * 源端当前的 WAL 写入位置
     */
    public long currentWalLsn() {
        try (Connection conn = ds.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT pg_current_wal_lsn()::text")) {
            rs.next();
            return LogSequenceNumber.valueOf(rs.getString(1)).asLong();
        } catch (SQLException e) {
            throw new ConnectionException("读取当前 WAL 位置失败: " + e.getMessage(), e);
        }
    }

    /**
     * @return 发布中的表，发布不存在时返回 null
     */
    private static Set<TableId> publishedTables(Connection conn, String publication) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM pg_publication WHERE pubname = ?")) {
            ps.setString(1, publication);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
            }
        }
        Set<TableId> tables = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT schemaname, tablename FROM pg_publication_tables WHERE pubname = ?")) {
            ps.setString(1, publication);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tables.add(new TableId(rs.getString(1), rs.getString(2)));
                }
            }
        }
        return tables;
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            log.info("[SQL] {}", sql);
            st.execute(sql);
        }
    }

    private static String tableList(List<TableId> tables) {
        return tables.stream().map(t -> quote(t.schema()) + "." + quote(t.name())).collect(Collectors.joining(", "));
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
