package com.lhcz.pgcdc.error;

/**
 * 网络/传输层故障，退避后从最后的进度点重连
 */
public class ConnectionException extends ReplicationException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
