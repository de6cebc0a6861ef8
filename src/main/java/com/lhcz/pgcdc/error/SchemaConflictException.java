package com.lhcz.pgcdc.error;

import com.lhcz.pgcdc.model.TableId;

/**
 * 源端出现了破坏性的结构变化 (类型收窄或不兼容)，目标端只允许追加列
 */
public class SchemaConflictException extends ReplicationException {

    private final TableId table;
    private final String column;

    public SchemaConflictException(TableId table, String column, String message) {
        super("表 " + table + " 列 " + column + " 结构冲突: " + message, false);
        this.table = table;
        this.column = column;
    }

    public TableId getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }
}
