package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.sink.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * 运行模式编排：全量 (full_load) 与增量 (cdc) 互斥
 * <p>
 * 互斥通过目标端的锁表实现，每个目标 schema 一把锁，持有者为模式名。
 * 同一模式重启可以直接接管残留的锁；另一模式残留的锁需要人工清理。
 */
public class ModeOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ModeOrchestrator.class);

    public enum Mode {
        FULL_LOAD,
        CDC;

        /**
         * 解析 "full_load" / "cdc" (不区分大小写)
         */
        public static Mode parse(String text) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("未指定运行模式 (full_load | cdc)");
            }
            String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return Mode.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("未知的运行模式: " + text + " (可选 full_load | cdc)", e);
            }
        }
    }

    private final Destination destination;
    private final CheckpointManager checkpointManager;
    private final String lockName;
    private final boolean requireBackfill;

    public ModeOrchestrator(Destination destination, CheckpointManager checkpointManager, String lockName,
                            boolean requireBackfill) {
        this.destination = destination;
        this.checkpointManager = checkpointManager;
        this.lockName = lockName;
        this.requireBackfill = requireBackfill;
    }

    /**
     * 持锁执行任务，结束 (包括异常) 后释放锁
     */
    public void run(Mode mode, List<TableId> tables, Runnable task) {
        String owner = mode.name();
        if (!destination.tryLock(lockName, owner)) {
            throw new IllegalStateException("锁 " + lockName + " 已被其他模式持有，拒绝以 " + mode + " 模式运行");
        }
        log.info("🔒 已获取锁 {} (模式 {})", lockName, mode);
        try {
            if (mode == Mode.CDC && requireBackfill) {
                List<TableId> missing = tables.stream().filter(t -> !checkpointManager.isBackfilled(t)).toList();
                if (!missing.isEmpty()) {
                    throw new IllegalStateException("以下表尚未完成全量，请先以 full_load 模式运行: " + missing);
                }
            }
            task.run();
        } finally {
            destination.unlock(lockName, owner);
            log.info("🔓 已释放锁 {}", lockName);
        }
    }
}
