package com.lhcz.pgcdc.util;

import com.lhcz.pgcdc.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HikariCP 连接池构建
 */
public final class DataSources {
    private static final Logger log = LoggerFactory.getLogger(DataSources.class);

    private DataSources() {
    }

    public static HikariDataSource source(AppConfig.DbConfig db) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("pgcdc-source");
        hikariConfig.setJdbcUrl(db.url());
        hikariConfig.setUsername(db.user());
        hikariConfig.setPassword(db.password());

        // 应用稳健的连接池参数
        long maxLifetime = (db.maxLifetimeMs() != null) ? db.maxLifetimeMs() : 600000L; // 默认10分钟
        long idleTimeout = (db.idleTimeoutMs() != null) ? db.idleTimeoutMs() : 300000L; // 默认5分钟
        int minIdle = (db.minIdle() != null) ? db.minIdle() : 1;
        int maxPoolSize = (db.maxPoolSize() != null) ? db.maxPoolSize() : 4;

        log.info("源端连接池配置: MaxLifetime={}ms, IdleTimeout={}ms, PoolSize={}", maxLifetime, idleTimeout, maxPoolSize);

        hikariConfig.setMaxLifetime(maxLifetime);
        hikariConfig.setIdleTimeout(idleTimeout);
        hikariConfig.setMinimumIdle(minIdle);
        hikariConfig.setMaximumPoolSize(maxPoolSize);

        // 开启 TCP KeepAlive 防止防火墙静默切断连接
        hikariConfig.addDataSourceProperty("socketTimeout", "30000");
        hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        return new HikariDataSource(hikariConfig);
    }

    public static HikariDataSource destination(AppConfig.DestinationConfig dest, int workers) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("pgcdc-destination");
        hikariConfig.setJdbcUrl(dest.url());
        hikariConfig.setUsername(dest.user());
        hikariConfig.setPassword(dest.password());
        // 每个写入线程一个连接，外加进度写入与锁
        int maxPoolSize = (dest.maxPoolSize() != null) ? dest.maxPoolSize() : workers + 2;
        hikariConfig.setMaximumPoolSize(maxPoolSize);
        hikariConfig.setMinimumIdle(1);
        log.info("目标端连接池配置: PoolSize={}", maxPoolSize);
        return new HikariDataSource(hikariConfig);
    }
}
