package com.lhcz.pgcdc.error;

/**
 * WAL 消息格式错误或包含不支持的类型
 */
public class DecodeException extends ReplicationException {

    public DecodeException(String message) {
        super(message, false);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
