package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.error.CheckpointGapException;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.sink.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 复制进度管理，进度保存在目标端
 * <p>
 * 两级进度：
 * <ul>
 *     <li>会话进度：低于该位置的事务全部已落地，重启时从这里开始拉流，也是回报给源端的位置</li>
 *     <li>表进度：每张表已落地的最后一条记录，批次必须与之首尾相接</li>
 * </ul>
 * 表进度只在批次写入成功后推进 (写入线程)，会话进度只由解码线程推进。
 */
public class CheckpointManager {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    static final String SESSION_SCOPE = "session";
    static final String TABLE_PREFIX = "table:";
    static final String BACKFILL_PREFIX = "backfill:";

    private final Destination destination;
    private final String slotName;
    private final Map<String, StreamPosition> positions = new HashMap<>();

    public CheckpointManager(Destination destination, String slotName) {
        this.destination = destination;
        this.slotName = slotName;
        reload();
    }

    public synchronized void reload() {
        positions.clear();
        positions.putAll(destination.readCheckpoints(slotName));
        if (positions.isEmpty()) {
            log.info("未找到历史进度 (slot={})，将从复制槽的起点开始", slotName);
        } else {
            log.info("已加载历史进度 (slot={}): {}", slotName, positions);
        }
    }

    /**
     * 会话恢复位置，首次运行返回 {@link StreamPosition#BEGINNING}
     */
    public synchronized StreamPosition load() {
        return positions.getOrDefault(SESSION_SCOPE, StreamPosition.BEGINNING);
    }

    public synchronized StreamPosition load(TableId table) {
        return positions.getOrDefault(TABLE_PREFIX + table, StreamPosition.BEGINNING);
    }

    /**
     * 批次落地后推进表进度。批次下界必须等于当前表进度，否则说明有批次被跳过或乱序。
     */
    public synchronized void advance(Batch batch) {
        String scope = TABLE_PREFIX + batch.table();
        StreamPosition stored = positions.getOrDefault(scope, StreamPosition.BEGINNING);
        if (!batch.low().equals(stored)) {
            throw new CheckpointGapException(scope, stored, batch.low());
        }
        if (batch.high().isBefore(batch.low())) {
            throw new CheckpointGapException(scope, stored, batch.high());
        }
        destination.writeCheckpoint(slotName, scope, batch.high());
        positions.put(scope, batch.high());
        log.debug("表进度推进: {} {} -> {}", batch.table(), stored, batch.high());
    }

    /**
     * 推进会话进度；与当前相同时不写，回退视为程序错误
     *
     * @return 是否实际写入
     */
    public synchronized boolean advanceSession(StreamPosition position) {
        StreamPosition stored = positions.getOrDefault(SESSION_SCOPE, StreamPosition.BEGINNING);
        if (position.isBefore(stored)) {
            throw new CheckpointGapException(SESSION_SCOPE, stored, position);
        }
        if (position.equals(stored)) {
            return false;
        }
        destination.writeCheckpoint(slotName, SESSION_SCOPE, position);
        positions.put(SESSION_SCOPE, position);
        log.info("会话进度推进: {} -> {}", stored, position);
        return true;
    }

    /**
     * 全量完成标记，position 为全量开始前读取的 WAL 位置
     */
    public synchronized void markBackfilled(TableId table, StreamPosition position) {
        destination.writeCheckpoint(slotName, BACKFILL_PREFIX + table, position);
        positions.put(BACKFILL_PREFIX + table, position);
    }

    public synchronized boolean isBackfilled(TableId table) {
        return positions.containsKey(BACKFILL_PREFIX + table);
    }
}
