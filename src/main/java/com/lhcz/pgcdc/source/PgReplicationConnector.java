package com.lhcz.pgcdc.source;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.error.ConnectionException;
import com.lhcz.pgcdc.model.StreamPosition;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * 基于 PostgreSQL JDBC 驱动的逻辑复制连接 (pgoutput 插件，协议版本 1)
 * <p>
 * 复制连接不能走连接池，每次 open 都新建一个物理连接。
 */
public class PgReplicationConnector implements ReplicationConnector {
    private static final Logger log = LoggerFactory.getLogger(PgReplicationConnector.class);

    private final AppConfig.DbConfig db;
    private final AppConfig.ReplicationConfig replication;
    private final ReplicationSetup setup;

    public PgReplicationConnector(AppConfig.DbConfig db, AppConfig.ReplicationConfig replication, ReplicationSetup setup) {
        this.db = db;
        this.replication = replication;
        this.setup = setup;
    }

    @Override
    public WalStream open(StreamPosition start) {
        setup.ensureSlot();

        Properties props = new Properties();
        PGProperty.USER.set(props, db.user());
        PGProperty.PASSWORD.set(props, db.password());
        PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
        PGProperty.REPLICATION.set(props, "database");
        PGProperty.PREFER_QUERY_MODE.set(props, "simple");
        PGProperty.TCP_KEEP_ALIVE.set(props, true);

        Connection conn = null;
        try {
            conn = DriverManager.getConnection(db.url(), props);
            PGConnection pgConnection = conn.unwrap(PGConnection.class);
            LogSequenceNumber lsn = start.isBeginning() ? LogSequenceNumber.INVALID_LSN : LogSequenceNumber.valueOf(start.lsn());

            PGReplicationStream stream = pgConnection.getReplicationAPI()
                    .replicationStream()
                    .logical()
                    .withSlotName(replication.slotNameOrDefault())
                    .withSlotOption("proto_version", "1")
                    .withSlotOption("publication_names", replication.publicationNameOrDefault())
                    .withStartPosition(lsn)
                    .withStatusInterval((int) replication.statusIntervalMsOrDefault(), TimeUnit.MILLISECONDS)
                    .start();
            log.info("🔗 复制流已建立: slot={}, publication={}, 起点={}",
                    replication.slotNameOrDefault(), replication.publicationNameOrDefault(),
                    start.isBeginning() ? "(复制槽确认位置)" : start.lsnString());
            return new PgWalStream(conn, stream);
        } catch (SQLException e) {
            closeQuietly(conn, e);
            throw new ConnectionException("建立复制连接失败: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection conn, Exception cause) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException closeError) {
            cause.addSuppressed(closeError);
        }
    }

    static final class PgWalStream implements WalStream {
        private final Connection conn;
        private final PGReplicationStream stream;

        PgWalStream(Connection conn, PGReplicationStream stream) {
            this.conn = conn;
            this.stream = stream;
        }

        @Override
        public ByteBuffer read() {
            try {
                return stream.readPending();
            } catch (SQLException e) {
                throw new ConnectionException("读取复制流失败: " + e.getMessage(), e);
            }
        }

        @Override
        public long lastReceiveLsn() {
            LogSequenceNumber lsn = stream.getLastReceiveLSN();
            return lsn == null ? 0L : lsn.asLong();
        }

        @Override
        public void acknowledge(long lsn) {
            LogSequenceNumber position = LogSequenceNumber.valueOf(lsn);
            stream.setAppliedLSN(position);
            stream.setFlushedLSN(position);
            try {
                stream.forceUpdateStatus();
            } catch (SQLException e) {
                throw new ConnectionException("回报复制进度失败: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                if (!stream.isClosed()) {
                    stream.close();
                }
            } catch (SQLException e) {
                log.warn("关闭复制流失败: {}", e.getMessage());
            }
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("关闭复制连接失败: {}", e.getMessage());
            }
        }
    }
}
