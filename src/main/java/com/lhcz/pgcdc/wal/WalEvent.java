package com.lhcz.pgcdc.wal;

import com.lhcz.pgcdc.model.RelationDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * pgoutput 协议事件
 */
public sealed interface WalEvent {

    /**
     * 该消息在 WAL 中的位置 (XLogData 起始位置)，Keepalive 为最后收到的位置
     */
    long walPosition();

    record Begin(long walPosition, long finalLsn, Instant commitTime, int xid) implements WalEvent {
    }

    record Commit(long walPosition, long commitLsn, long endLsn, Instant commitTime) implements WalEvent {
    }

    record RelationUpdate(long walPosition, RelationDescriptor relation) implements WalEvent {
    }

    record Insert(long walPosition, RelationDescriptor relation, Map<String, Object> newTuple) implements WalEvent {
    }

    /**
     * @param oldTuple 变更前镜像，可能为 null；oldKind='K' 时只含主键列
     * @param oldKind  'K' (复制标识键)、'O' (整行) 或 0 (未携带)
     */
    record Update(long walPosition, RelationDescriptor relation, Map<String, Object> oldTuple, char oldKind,
                  Map<String, Object> newTuple) implements WalEvent {
    }

    record Delete(long walPosition, RelationDescriptor relation, Map<String, Object> oldTuple, char oldKind)
            implements WalEvent {
    }

    record Truncate(long walPosition, List<RelationDescriptor> relations, boolean cascade, boolean restartIdentity)
            implements WalEvent {
    }

    record Keepalive(long walPosition) implements WalEvent {
    }

    /**
     * Origin / Type / Message 等对复制结果无影响的消息
     */
    record Ignored(long walPosition, char kind) implements WalEvent {
    }
}
