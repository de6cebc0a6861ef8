package com.lhcz.pgcdc.core;

/**
 * 复制会话状态
 * <pre>
 * DISCONNECTED -> NEGOTIATING -> STREAMING -> DISCONNECTED (重连)
 *                                          -> STOPPED (正常停止)
 *                                          -> FAILED  (致命错误)
 * </pre>
 */
public enum SessionState {
    DISCONNECTED,
    NEGOTIATING,
    STREAMING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
