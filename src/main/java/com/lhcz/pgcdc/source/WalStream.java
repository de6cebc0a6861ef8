package com.lhcz.pgcdc.source;

import java.nio.ByteBuffer;

/**
 * 一条已建立的逻辑复制流
 * <p>
 * 传输层故障统一抛出 {@link com.lhcz.pgcdc.error.ConnectionException}。
 */
public interface WalStream extends AutoCloseable {

    /**
     * 非阻塞读取下一条消息
     *
     * @return 消息内容，当前没有数据时返回 null
     */
    ByteBuffer read();

    /**
     * 最近收到的 WAL 位置 (消息或心跳)
     */
    long lastReceiveLsn();

    /**
     * 向源端确认该位置之前的 WAL 已落地，源端可以回收
     */
    void acknowledge(long lsn);

    @Override
    void close();
}
