package com.lhcz.pgcdc.error;

import com.lhcz.pgcdc.model.StreamPosition;

/**
 * 进度推进不连续或回退，说明批次被跳过或乱序 (程序逻辑错误)
 */
public class CheckpointGapException extends ReplicationException {

    private final StreamPosition stored;
    private final StreamPosition requested;

    public CheckpointGapException(String scope, StreamPosition stored, StreamPosition requested) {
        super("进度不连续 [" + scope + "]: 当前=" + stored + ", 请求=" + requested, false);
        this.stored = stored;
        this.requested = requested;
    }

    public StreamPosition getStored() {
        return stored;
    }

    public StreamPosition getRequested() {
        return requested;
    }
}
