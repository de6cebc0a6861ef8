package com.lhcz.pgcdc.sink;

/**
 * 暂存区：批次在写入目标表前先落一份，写入成功后清理
 */
public interface StagingArea {

    StagedBatch stage(MergePlan plan);

    void discard(StagedBatch staged);
}
