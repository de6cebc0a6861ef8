package com.lhcz.pgcdc.error;

/**
 * 批次写入目标端失败。重试次数内可重放同一批次，耗尽后为致命错误。
 */
public class ApplyException extends ReplicationException {

    public ApplyException(String message, Throwable cause) {
        super(message, cause, true);
    }

    public ApplyException(String message, Throwable cause, boolean retriable) {
        super(message, cause, retriable);
    }

    public ApplyException exhausted(int attempts) {
        return new ApplyException("重试 " + attempts + " 次后仍然失败: " + getMessage(), this, false);
    }
}
