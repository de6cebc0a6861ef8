package com.lhcz.pgcdc.wal;

import com.lhcz.pgcdc.error.DecodeException;
import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.LogicalType;
import com.lhcz.pgcdc.model.RelationDescriptor;
import com.lhcz.pgcdc.model.TableId;
import com.lhcz.pgcdc.model.UnchangedToast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * pgoutput 逻辑复制消息解码器
 * <p>
 * 一条 XLogData 负载对应一个事件。Relation 消息在返回前同步写入 {@link RelationCache}，
 * 之后的行事件才能按位置还原列。任何格式错误都直接抛出 {@link DecodeException}，不做部分恢复。
 */
public class PgOutputDecoder {
    private static final Logger log = LoggerFactory.getLogger(PgOutputDecoder.class);

    private final RelationCache relations;

    public PgOutputDecoder(RelationCache relations) {
        this.relations = relations;
    }

    public WalEvent decode(ByteBuffer message, long walPosition) {
        if (!message.hasRemaining()) {
            throw new DecodeException("空消息 @ " + walPosition);
        }
        char kind = (char) message.get();
        try {
            WalEvent event = switch (kind) {
                case 'B' -> decodeBegin(message, walPosition);
                case 'C' -> decodeCommit(message, walPosition);
                case 'R' -> decodeRelation(message, walPosition);
                case 'I' -> decodeInsert(message, walPosition);
                case 'U' -> decodeUpdate(message, walPosition);
                case 'D' -> decodeDelete(message, walPosition);
                case 'T' -> decodeTruncate(message, walPosition);
                case 'O', 'Y', 'M' -> new WalEvent.Ignored(walPosition, kind);
                default -> throw new DecodeException("未知的消息类型 '" + kind + "' @ " + walPosition);
            };
            if (event instanceof WalEvent.Ignored) {
                log.trace("跳过消息 '{}' @ {}", kind, walPosition);
                return event;
            }
            if (message.hasRemaining()) {
                throw new DecodeException("消息 '" + kind + "' 结尾多出 " + message.remaining() + " 字节");
            }
            return event;
        } catch (BufferUnderflowException e) {
            throw new DecodeException("消息 '" + kind + "' 被截断 @ " + walPosition, e);
        }
    }

    private WalEvent.Begin decodeBegin(ByteBuffer buf, long walPosition) {
        long finalLsn = buf.getLong();
        long commitMicros = buf.getLong();
        int xid = buf.getInt();
        return new WalEvent.Begin(walPosition, finalLsn, ValueDecoder.fromPgMicros(commitMicros), xid);
    }

    private WalEvent.Commit decodeCommit(ByteBuffer buf, long walPosition) {
        buf.get(); // flags, 目前未使用
        long commitLsn = buf.getLong();
        long endLsn = buf.getLong();
        long commitMicros = buf.getLong();
        return new WalEvent.Commit(walPosition, commitLsn, endLsn, ValueDecoder.fromPgMicros(commitMicros));
    }

    private WalEvent.RelationUpdate decodeRelation(ByteBuffer buf, long walPosition) {
        int relationId = buf.getInt();
        String namespace = readString(buf);
        String name = readString(buf);
        char replicaIdentity = (char) buf.get();
        int columnCount = buf.getShort();
        List<ColumnDescriptor> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            boolean key = (buf.get() & 1) != 0;
            String columnName = readString(buf);
            int typeOid = buf.getInt();
            int typeModifier = buf.getInt();
            if (!LogicalType.isSupported(typeOid)) {
                throw new DecodeException("表 " + namespace + "." + name + " 列 " + columnName + " 使用了不支持的类型 OID " + typeOid);
            }
            columns.add(new ColumnDescriptor(columnName, LogicalType.fromOid(typeOid), typeOid, typeModifier, key));
        }
        // pgoutput 对 pg_catalog 发送空 namespace
        TableId table = new TableId(namespace.isEmpty() ? "pg_catalog" : namespace, name);
        RelationDescriptor relation = new RelationDescriptor(relationId, table, replicaIdentity, columns);
        relations.update(relation);
        return new WalEvent.RelationUpdate(walPosition, relation);
    }

    private WalEvent.Insert decodeInsert(ByteBuffer buf, long walPosition) {
        RelationDescriptor relation = relations.resolve(buf.getInt());
        expectTag(buf, 'N', "INSERT");
        return new WalEvent.Insert(walPosition, relation, readTuple(buf, relation));
    }

    private WalEvent.Update decodeUpdate(ByteBuffer buf, long walPosition) {
        RelationDescriptor relation = relations.resolve(buf.getInt());
        char tag = (char) buf.get();
        Map<String, Object> oldTuple = null;
        char oldKind = 0;
        if (tag == 'K' || tag == 'O') {
            oldKind = tag;
            oldTuple = readTuple(buf, relation);
            tag = (char) buf.get();
        }
        if (tag != 'N') {
            throw new DecodeException("UPDATE 缺少新镜像标记 'N'，实际为 '" + tag + "'");
        }
        Map<String, Object> newTuple = readTuple(buf, relation);
        return new WalEvent.Update(walPosition, relation, keyOnly(oldTuple, oldKind, relation), oldKind, newTuple);
    }

    private WalEvent.Delete decodeDelete(ByteBuffer buf, long walPosition) {
        RelationDescriptor relation = relations.resolve(buf.getInt());
        char tag = (char) buf.get();
        if (tag != 'K' && tag != 'O') {
            throw new DecodeException("DELETE 旧镜像标记非法: '" + tag + "'");
        }
        Map<String, Object> oldTuple = readTuple(buf, relation);
        return new WalEvent.Delete(walPosition, relation, keyOnly(oldTuple, tag, relation), tag);
    }

    private WalEvent.Truncate decodeTruncate(ByteBuffer buf, long walPosition) {
        int count = buf.getInt();
        int options = buf.get();
        List<RelationDescriptor> truncated = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            truncated.add(relations.resolve(buf.getInt()));
        }
        return new WalEvent.Truncate(walPosition, truncated, (options & 1) != 0, (options & 2) != 0);
    }

    private Map<String, Object> readTuple(ByteBuffer buf, RelationDescriptor relation) {
        int columnCount = buf.getShort();
        List<ColumnDescriptor> columns = relation.columns();
        if (columnCount != columns.size()) {
            throw new DecodeException("表 " + relation.table() + " 行镜像列数 " + columnCount
                    + " 与结构列数 " + columns.size() + " 不一致");
        }
        Map<String, Object> tuple = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            char tag = (char) buf.get();
            switch (tag) {
                case 'n' -> tuple.put(column.name(), null);
                case 'u' -> tuple.put(column.name(), UnchangedToast.VALUE);
                case 't' -> tuple.put(column.name(), ValueDecoder.decodeText(column, new String(readBytes(buf), StandardCharsets.UTF_8)));
                case 'b' -> tuple.put(column.name(), ValueDecoder.decodeBinary(column, readBytes(buf)));
                default -> throw new DecodeException("表 " + relation.table() + " 列 " + column.name() + " 未知的值标记 '" + tag + "'");
            }
        }
        return tuple;
    }

    /**
     * 'K' 镜像只有复制标识列有意义，其余列以 NULL 占位，应视为 "未知" 而非 "为空"
     */
    private static Map<String, Object> keyOnly(Map<String, Object> tuple, char kind, RelationDescriptor relation) {
        if (tuple == null || kind != 'K') {
            return tuple;
        }
        Map<String, Object> keys = new LinkedHashMap<>();
        for (ColumnDescriptor column : relation.keyColumns()) {
            keys.put(column.name(), tuple.get(column.name()));
        }
        return keys;
    }

    private static byte[] readBytes(ByteBuffer buf) {
        int length = buf.getInt();
        if (length < 0 || length > buf.remaining()) {
            throw new DecodeException("非法的值长度: " + length + " (剩余 " + buf.remaining() + " 字节)");
        }
        byte[] bytes = new byte[length];
        buf.get(bytes);
        return bytes;
    }

    private static void expectTag(ByteBuffer buf, char expected, String what) {
        char tag = (char) buf.get();
        if (tag != expected) {
            throw new DecodeException(what + " 期望标记 '" + expected + "'，实际为 '" + tag + "'");
        }
    }

    private static String readString(ByteBuffer buf) {
        int start = buf.position();
        int end = start;
        while (end < buf.limit() && buf.get(end) != 0) {
            end++;
        }
        if (end >= buf.limit()) {
            throw new DecodeException("字符串缺少结束符");
        }
        byte[] bytes = new byte[end - start];
        buf.get(bytes);
        buf.get(); // '\0'
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
