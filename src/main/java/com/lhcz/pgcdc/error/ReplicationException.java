package com.lhcz.pgcdc.error;

/**
 * 复制引擎异常基类
 * <p>
 * retriable=true 的异常可以原样重试 (重连、重放同一批次)，其余异常都会使会话停止，
 * 进度保持在最后一个成功落地的批次，修复问题后重启即可从该处继续。
 */
public class ReplicationException extends RuntimeException {

    private final boolean retriable;

    public ReplicationException(String message, boolean retriable) {
        super(message);
        this.retriable = retriable;
    }

    public ReplicationException(String message, Throwable cause, boolean retriable) {
        super(message, cause);
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
