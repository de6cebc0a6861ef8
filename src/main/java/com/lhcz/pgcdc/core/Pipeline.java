package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.sink.JdbcDestination;
import com.lhcz.pgcdc.sink.LocalStagingArea;
import com.lhcz.pgcdc.sink.SqlDialect;
import com.lhcz.pgcdc.source.PgReplicationConnector;
import com.lhcz.pgcdc.source.ReplicationSetup;
import com.lhcz.pgcdc.util.DataSources;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * 核心流水线控制器：组装各组件，按模式运行
 */
public class Pipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final AppConfig config;
    private final AppConfig.ReplicationConfig replication;

    private HikariDataSource sourceDs;
    private JdbcDestination destination;
    private volatile ReplicationSession session;
    private WebConsole webConsole;

    public Pipeline(AppConfig config) {
        this.config = config;
        this.replication = config.replicationOrDefault();
    }

    public void run(ModeOrchestrator.Mode mode) {
        log.info(" 正在初始化数据库连接池 (HikariCP)...");
        sourceDs = DataSources.source(config.source());
        AppConfig.DestinationConfig destConfig = config.destination();
        SqlDialect dialect = destConfig.dialect() == null ? SqlDialect.POSTGRES
                : SqlDialect.valueOf(destConfig.dialect().trim().toUpperCase(Locale.ROOT));
        destination = new JdbcDestination(DataSources.destination(destConfig, config.applyOrDefault().workersOrDefault()),
                dialect, destConfig.catalog(), destConfig.schemaOrDefault());
        destination.init();

        // 管理器组件
        CheckpointManager checkpointManager = new CheckpointManager(destination, replication.slotNameOrDefault());
        DeadLetterQueueManager deadLetterQueueManager = new DeadLetterQueueManager(config.applyOrDefault().failedDirOrDefault());
        MergeLoader mergeLoader = new MergeLoader(destination, new LocalStagingArea(Path.of(destConfig.stagingDirOrDefault())),
                config.applyOrDefault(), deadLetterQueueManager);
        ReplicationSetup setup = new ReplicationSetup(sourceDs, replication);

        List<TableId> tables = setup.tables();
        ModeOrchestrator orchestrator = new ModeOrchestrator(destination, checkpointManager,
                "pipeline:" + destConfig.schemaOrDefault(), replication.requireBackfillOrDefault());

        orchestrator.run(mode, tables, () -> {
            if (mode == ModeOrchestrator.Mode.FULL_LOAD) {
                new SnapshotLoader(sourceDs, setup, mergeLoader, destination, checkpointManager,
                        replication.snapshotPageSizeOrDefault())
                        .loadAll(tables);
                return;
            }
            setup.ensurePublication(tables);
            Clock clock = Clock.systemUTC();
            FlushController flushController = new FlushController(config.flushOrDefault(), checkpointManager, clock);
            session = new ReplicationSession(new PgReplicationConnector(config.source(), replication, setup),
                    flushController, mergeLoader, checkpointManager, replication, config.applyOrDefault(), clock);

            // 启动 Web 控制台 (如果配置了端口)
            if (config.web() != null && config.web().port() != null) {
                webConsole = new WebConsole(config.web().port(), session);
                webConsole.start();
            }
            log.info("启动增量复制: {} 张表 -> {}", tables.size(), destConfig.schemaOrDefault());
            session.run();
        });
    }

    /**
     * 请求停止 (关闭钩子中调用)
     */
    public void stop() {
        ReplicationSession current = session;
        if (current != null) {
            current.stop();
        }
    }

    @Override
    public void close() {
        if (webConsole != null) {
            webConsole.stop();
        }
        if (destination != null) {
            destination.close();
        }
        if (sourceDs != null) {
            sourceDs.close();
        }
    }
}
