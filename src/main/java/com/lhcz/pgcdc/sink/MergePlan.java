package com.lhcz.pgcdc.sink;

import com.lhcz.pgcdc.model.ColumnDescriptor;
import com.lhcz.pgcdc.model.StreamPosition;
import com.lhcz.pgcdc.model.TableId;

import java.util.List;
import java.util.Map;

/**
 * 折叠后的批次写入计划，目标端必须原子执行：先整表清空 (可选)，再按键删除，最后按键 upsert。
 * 同一个键在 deletes 与 upserts 中最多出现一次。
 *
 * @param table      源表
 * @param keyColumns 主键列名
 * @param columns    当前表结构 (决定列类型)
 * @param truncate   是否先清空整表
 * @param deletes    需要删除的主键值
 * @param upserts    需要写入的行；缺失的列 (未变更的 TOAST 值) 在目标端保持原值
 * @param low        批次下界 (不含)
 * @param high       批次上界
 */
public record MergePlan(TableId table,
                        List<String> keyColumns,
                        List<ColumnDescriptor> columns,
                        boolean truncate,
                        List<List<Object>> deletes,
                        List<Map<String, Object>> upserts,
                        StreamPosition low,
                        StreamPosition high) {

    public boolean isNoop() {
        return !truncate && deletes.isEmpty() && upserts.isEmpty();
    }
}
