package com.lhcz.pgcdc.model;

import java.util.List;

/**
 * 一张表的一次刷写批次，按提交顺序排列。
 *
 * @param table   表
 * @param records 变更记录 (提交顺序)
 * @param low     不含的下界：该表上一次已提交的位置
 * @param high    最后一条记录的位置
 */
public record Batch(TableId table, List<ChangeRecord> records, StreamPosition low, StreamPosition high) {

    public Batch {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
