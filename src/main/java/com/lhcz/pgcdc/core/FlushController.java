package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按表缓冲变更记录，决定何时刷写
 * <p>
 * 每张表一个独立缓冲，达到行数/字节数阈值或最早一条记录等待超过刷写间隔时需要刷写。
 * 同一张表同时最多一个在途批次：在途期间缓冲继续累积但不会触发刷写 (背压)，
 * 待在途批次完成后再刷。批次下界取该表已落地的位置，所以同表批次首尾相接。
 */
public class FlushController {
    private static final Logger log = LoggerFactory.getLogger(FlushController.class);

    private final AppConfig.FlushConfig config;
    private final CheckpointManager checkpoints;
    private final Clock clock;
    private final Map<TableId, Lane> lanes = new LinkedHashMap<>();

    public FlushController(AppConfig.FlushConfig config, CheckpointManager checkpoints, Clock clock) {
        this.config = config;
        this.checkpoints = checkpoints;
        this.clock = clock;
    }

    /**
     * 追加一条记录
     *
     * @return false 表示该记录此前已落地 (重连后的重放)，已丢弃
     */
    public synchronized boolean append(ChangeRecord record) {
        Lane lane = lane(record.table());
        if (!record.position().isAfter(lane.committed)) {
            lane.skipped++;
            log.debug("跳过已落地的记录: {} @ {}", record.table(), record.position());
            return false;
        }
        if (!record.position().isAfter(lane.tail)) {
            throw new IllegalStateException("表 " + record.table() + " 记录乱序: " + record.position() + " <= " + lane.tail);
        }
        if (lane.buffer.isEmpty()) {
            lane.oldestAt = clock.millis();
        }
        lane.buffer.add(record);
        lane.bytes += estimateSize(record);
        lane.tail = record.position();
        lane.appended++;
        return true;
    }

    public synchronized boolean shouldFlush(TableId table) {
        Lane lane = lanes.get(table);
        return lane != null && isDue(lane, clock.millis());
    }

    public synchronized List<TableId> dueTables() {
        long now = clock.millis();
        List<TableId> due = new ArrayList<>();
        for (Map.Entry<TableId, Lane> entry : lanes.entrySet()) {
            if (isDue(entry.getValue(), now)) {
                due.add(entry.getKey());
            }
        }
        return due;
    }

    /**
     * 取出该表缓冲的全部记录作为一个批次，并标记为在途
     */
    public synchronized Batch takeBatch(TableId table) {
        Lane lane = lanes.get(table);
        if (lane == null || lane.buffer.isEmpty()) {
            throw new IllegalStateException("表 " + table + " 没有待刷写的记录");
        }
        if (lane.inFlight != null) {
            throw new IllegalStateException("表 " + table + " 已有在途批次 " + lane.inFlight.high());
        }
        List<ChangeRecord> records = new ArrayList<>(lane.buffer);
        Batch batch = new Batch(table, records, lane.committed, records.get(records.size() - 1).position());
        lane.buffer.clear();
        lane.bytes = 0;
        lane.oldestAt = -1;
        lane.inFlight = batch;
        return batch;
    }

    /**
     * 取出该表缓冲中位于 upTo 及之前的记录 (已提交事务) 作为一个批次，其余记录留在缓冲中
     *
     * @return 没有可取的记录或该表已有在途批次时返回 null
     */
    public synchronized Batch takeCommitted(TableId table, StreamPosition upTo) {
        Lane lane = lanes.get(table);
        if (lane == null || lane.inFlight != null || lane.buffer.isEmpty()) {
            return null;
        }
        int count = 0;
        while (count < lane.buffer.size() && !lane.buffer.get(count).position().isAfter(upTo)) {
            count++;
        }
        if (count == 0) {
            return null;
        }
        List<ChangeRecord> records = new ArrayList<>(lane.buffer.subList(0, count));
        lane.buffer.subList(0, count).clear();
        lane.bytes = 0;
        for (ChangeRecord record : lane.buffer) {
            lane.bytes += estimateSize(record);
        }
        lane.oldestAt = lane.buffer.isEmpty() ? -1 : clock.millis();
        Batch batch = new Batch(table, records, lane.committed, records.get(records.size() - 1).position());
        lane.inFlight = batch;
        return batch;
    }

    public synchronized List<TableId> bufferedTables() {
        List<TableId> tables = new ArrayList<>();
        for (Map.Entry<TableId, Lane> entry : lanes.entrySet()) {
            if (!entry.getValue().buffer.isEmpty()) {
                tables.add(entry.getKey());
            }
        }
        return tables;
    }

    /**
     * 批次落地成功
     */
    public synchronized void complete(Batch batch) {
        Lane lane = lanes.get(batch.table());
        if (lane == null || lane.inFlight != batch) {
            throw new IllegalStateException("表 " + batch.table() + " 没有对应的在途批次");
        }
        lane.committed = batch.high();
        lane.inFlight = null;
        lane.appliedBatches++;
        lane.appliedRecords += batch.size();
    }

    /**
     * 计算安全的会话进度：所有缓冲中和在途的记录都还没落地，它们所在事务之前的位置才是安全的
     *
     * @param lastCommitted 解码线程已完整处理的最后一个事务，可为 null
     * @return 安全位置；没有任何可推进的信息时返回 null
     */
    public synchronized StreamPosition safePosition(StreamPosition lastCommitted) {
        StreamPosition minPending = null;
        for (Lane lane : lanes.values()) {
            StreamPosition first = lane.firstPending();
            if (first != null && (minPending == null || first.isBefore(minPending))) {
                minPending = first;
            }
        }
        if (minPending == null) {
            return lastCommitted;
        }
        StreamPosition bound = StreamPosition.endOf(minPending.lsn() - 1);
        return lastCommitted == null ? bound : StreamPosition.min(bound, lastCommitted);
    }

    /**
     * 有表在等待在途批次的同时又攒满了一个批次，此时解码线程应暂停读取
     */
    public synchronized boolean saturated() {
        for (Lane lane : lanes.values()) {
            if (lane.inFlight != null && lane.buffer.size() >= config.maxRowsOrDefault()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否还有缓冲中或在途的记录
     */
    public synchronized boolean hasPending() {
        for (Lane lane : lanes.values()) {
            if (lane.firstPending() != null) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean hasInFlight() {
        for (Lane lane : lanes.values()) {
            if (lane.inFlight != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 重连前丢弃尚未刷写的记录，它们会从进度点重新发送。必须在在途批次全部结束后调用。
     */
    public synchronized int discardBuffers() {
        if (hasInFlight()) {
            throw new IllegalStateException("仍有在途批次，不能丢弃缓冲");
        }
        int dropped = 0;
        for (Lane lane : lanes.values()) {
            dropped += lane.buffer.size();
            lane.buffer.clear();
            lane.bytes = 0;
            lane.oldestAt = -1;
            lane.tail = lane.committed;
        }
        if (dropped > 0) {
            log.info("丢弃 {} 条未刷写的记录，重连后重放", dropped);
        }
        return dropped;
    }

    public synchronized List<TableStats> stats() {
        List<TableStats> result = new ArrayList<>();
        for (Map.Entry<TableId, Lane> entry : lanes.entrySet()) {
            Lane lane = entry.getValue();
            result.add(new TableStats(entry.getKey().toString(), lane.buffer.size(), lane.bytes, lane.inFlight != null,
                    lane.committed.toString(), lane.appended, lane.appliedBatches, lane.appliedRecords, lane.skipped));
        }
        return result;
    }

    private boolean isDue(Lane lane, long now) {
        if (lane.buffer.isEmpty() || lane.inFlight != null) {
            return false;
        }
        return lane.buffer.size() >= config.maxRowsOrDefault()
                || lane.bytes >= config.maxBytesOrDefault()
                || now - lane.oldestAt >= config.intervalMsOrDefault();
    }

    private Lane lane(TableId table) {
        return lanes.computeIfAbsent(table, t -> new Lane(checkpoints.load(t)));
    }

    /**
     * 粗略估算记录占用的字节数，只用于触发刷写
     */
    static long estimateSize(ChangeRecord record) {
        long size = 64;
        size += estimateImage(record.before());
        size += estimateImage(record.after());
        return size;
    }

    private static long estimateImage(Map<String, Object> image) {
        if (image == null) {
            return 0;
        }
        long size = 0;
        for (Map.Entry<String, Object> entry : image.entrySet()) {
            size += entry.getKey().length() + 8;
            Object value = entry.getValue();
            if (value instanceof String s) {
                size += s.length() * 2L;
            } else if (value instanceof byte[] bytes) {
                size += bytes.length;
            } else if (value != null) {
                size += 16;
            }
        }
        return size;
    }

    /**
     * 每张表的缓冲与统计
     */
    public record TableStats(String table, int bufferedRows, long bufferedBytes, boolean inFlight, String committed,
                             long appendedRecords, long appliedBatches, long appliedRecords, long skippedRecords) {
    }

    private static final class Lane {
        private final List<ChangeRecord> buffer = new ArrayList<>();
        private long bytes;
        private long oldestAt = -1;
        private StreamPosition committed;
        private StreamPosition tail;
        private Batch inFlight;
        private long appended;
        private long appliedBatches;
        private long appliedRecords;
        private long skipped;

        private Lane(StreamPosition committed) {
            this.committed = committed;
            this.tail = committed;
        }

        private StreamPosition firstPending() {
            if (inFlight != null) {
                return inFlight.records().get(0).position();
            }
            return buffer.isEmpty() ? null : buffer.get(0).position();
        }
    }
}
