package com.lhcz.pgcdc.support;

import com.lhcz.pgcdc.error.ConnectionException;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.source.ReplicationConnector;
import com.lhcz.pgcdc.source.WalStream;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * 模拟源端：按事务保存消息，每次连接从起点所在事务开始重新发送 (与复制槽一样可能重发已确认的事务)。
 * 可以让第一次连接在读取若干条消息后断开。
 */
public class ScriptedConnector implements ReplicationConnector {

    private record Transaction(long finalLsn, List<byte[]> messages) {
    }

    private final List<Transaction> log = new ArrayList<>();
    private final List<StreamPosition> opens = new ArrayList<>();
    private int disconnectAfter = -1;
    private long acknowledged;
    private int closed;

    /**
     * 追加一个事务 (消息需包含 Begin/Commit)
     */
    public synchronized void append(long finalLsn, ByteBuffer... messages) {
        List<byte[]> copies = new ArrayList<>();
        for (ByteBuffer message : messages) {
            byte[] bytes = new byte[message.remaining()];
            message.duplicate().get(bytes);
            copies.add(bytes);
        }
        log.add(new Transaction(finalLsn, copies));
    }

    /**
     * 下一次连接读取 n 条消息后断开
     */
    public synchronized void disconnectAfter(int messages) {
        this.disconnectAfter = messages;
    }

    @Override
    public synchronized WalStream open(StreamPosition start) {
        opens.add(start);
        int failAfter = disconnectAfter;
        disconnectAfter = -1;
        return new ScriptedStream(start, failAfter);
    }

    public synchronized List<StreamPosition> opens() {
        return new ArrayList<>(opens);
    }

    public synchronized long acknowledged() {
        return acknowledged;
    }

    public synchronized int closed() {
        return closed;
    }

    private synchronized byte[] next(ScriptedStream stream) {
        while (stream.txnIndex < log.size()) {
            Transaction txn = log.get(stream.txnIndex);
            if (!stream.start.isBeginning() && Long.compareUnsigned(txn.finalLsn(), stream.start.lsn()) < 0) {
                stream.txnIndex++;
                continue;
            }
            if (stream.msgIndex < txn.messages().size()) {
                stream.lastReceive = txn.finalLsn();
                return txn.messages().get(stream.msgIndex++);
            }
            stream.txnIndex++;
            stream.msgIndex = 0;
        }
        return null;
    }

    private final class ScriptedStream implements WalStream {
        private final StreamPosition start;
        private final int failAfter;
        private int txnIndex;
        private int msgIndex;
        private int delivered;
        private long lastReceive;

        private ScriptedStream(StreamPosition start, int failAfter) {
            this.start = start;
            this.failAfter = failAfter;
            this.lastReceive = start.lsn();
        }

        @Override
        public ByteBuffer read() {
            if (failAfter >= 0 && delivered >= failAfter) {
                throw new ConnectionException("模拟网络中断", new java.io.EOFException());
            }
            byte[] bytes = next(this);
            if (bytes == null) {
                return null;
            }
            delivered++;
            return ByteBuffer.wrap(bytes);
        }

        @Override
        public long lastReceiveLsn() {
            return lastReceive;
        }

        @Override
        public void acknowledge(long lsn) {
            synchronized (ScriptedConnector.this) {
                acknowledged = Math.max(acknowledged, lsn);
            }
        }

        @Override
        public void close() {
            synchronized (ScriptedConnector.this) {
                closed++;
            }
        }
    }
}
