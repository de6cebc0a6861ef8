package com.lhcz.pgcdc.sink;

/**
 * 已暂存的批次
 *
 * @param location 暂存位置
 * @param plan     对应的写入计划
 */
public record StagedBatch(String location, MergePlan plan) {
}
