package com.lhcz.pgcdc.model;

/**
 * 未变更的 TOAST 列占位符。
 * 源端没有传输该列的值 (值未变且存放在行外)，与 NULL 含义不同：写入目标时不能覆盖原值。
 */
public final class UnchangedToast {

    public static final UnchangedToast VALUE = new UnchangedToast();

    private UnchangedToast() {
    }

    public static boolean is(Object value) {
        return value == VALUE;
    }

    @Override
    public String toString() {
        return "__unchanged_toast__";
    }
}
