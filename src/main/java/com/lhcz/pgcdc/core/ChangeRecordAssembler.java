package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.error.DecodeException;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.RelationDescriptor;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.wal.WalEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 把协议事件整理成变更记录
 * <p>
 * Begin/Commit/Keepalive 只维护事务上下文 (提交时间、当前位置)；行事件输出一条记录；
 * Truncate 对每张被清空的表输出一条整表删除标记。记录按流中的提交顺序输出。
 */
public class ChangeRecordAssembler {

    private long currentLsn = -1L;
    private Instant currentCommitTime;
    private int sequence;
    private StreamPosition lastCommitted;

    public List<ChangeRecord> assemble(WalEvent event) {
        if (event instanceof WalEvent.Begin begin) {
            currentLsn = begin.finalLsn();
            currentCommitTime = begin.commitTime();
            sequence = 0;
            return Collections.emptyList();
        }
        if (event instanceof WalEvent.Commit commit) {
            requireTransaction("COMMIT");
            lastCommitted = StreamPosition.endOf(commit.commitLsn());
            currentLsn = -1L;
            currentCommitTime = null;
            return Collections.emptyList();
        }
        if (event instanceof WalEvent.Insert insert) {
            requireTransaction("INSERT");
            return List.of(ChangeRecord.insert(insert.relation(), insert.newTuple(), currentCommitTime, nextPosition()));
        }
        if (event instanceof WalEvent.Update update) {
            requireTransaction("UPDATE");
            return List.of(ChangeRecord.update(update.relation(), update.oldTuple(), update.newTuple(),
                    currentCommitTime, nextPosition()));
        }
        if (event instanceof WalEvent.Delete delete) {
            requireTransaction("DELETE");
            requireKey(delete.relation(), delete.oldTuple());
            return List.of(ChangeRecord.delete(delete.relation(), delete.oldTuple(), currentCommitTime, nextPosition()));
        }
        if (event instanceof WalEvent.Truncate truncate) {
            requireTransaction("TRUNCATE");
            List<ChangeRecord> records = new ArrayList<>(truncate.relations().size());
            for (RelationDescriptor relation : truncate.relations()) {
                records.add(ChangeRecord.truncate(relation, currentCommitTime, nextPosition()));
            }
            return records;
        }
        // RelationUpdate / Keepalive / Ignored
        return Collections.emptyList();
    }

    /**
     * 最近一个完整处理的事务，尚无事务时为 null
     */
    public StreamPosition lastCommitted() {
        return lastCommitted;
    }

    public boolean inTransaction() {
        return currentLsn >= 0;
    }

    /**
     * 重连前丢弃事务上下文，流会从进度点重新发送。
     * lastCommitted 一并清空：被丢弃的缓冲记录可能位于它之前，重放完之前不能再以它为准。
     */
    public void reset() {
        currentLsn = -1L;
        currentCommitTime = null;
        sequence = 0;
        lastCommitted = null;
    }

    private StreamPosition nextPosition() {
        return new StreamPosition(currentLsn, ++sequence);
    }

    private void requireTransaction(String what) {
        if (currentLsn < 0) {
            throw new DecodeException(what + " 出现在事务之外 (缺少 BEGIN)");
        }
    }

    private static void requireKey(RelationDescriptor relation, Map<String, Object> before) {
        if (relation.keyColumns().isEmpty()) {
            throw new DecodeException("表 " + relation.table() + " 没有主键/复制标识，无法按键删除");
        }
        for (String key : relation.keyColumnNames()) {
            if (before == null || !before.containsKey(key) || before.get(key) == null) {
                throw new DecodeException("表 " + relation.table() + " 的 DELETE 缺少主键列 " + key);
            }
        }
    }
}
