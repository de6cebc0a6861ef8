package com.lhcz.pgcdc.source;

import com.lhcz.pgcdc.model.StreamPosition;

/**
 * 打开复制流。每次重连都会重新调用，实现方负责确保复制槽与发布存在。
 */
public interface ReplicationConnector {

    WalStream open(StreamPosition start);
}
