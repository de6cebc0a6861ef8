package com.lhcz.pgcdc.model;

/**
 * 复制流中的位置 (事务提交 LSN + 事务内序号)
 * <p>
 * lsn 取自 pgoutput Begin 消息中的 final_lsn，同一事务内的变更按 sequence 递增。
 * 按 (lsn, sequence) 全序比较，持久化后只增不减。
 *
 * @param lsn      事务提交 LSN
 * @param sequence 事务内变更序号，{@link Integer#MAX_VALUE} 表示整个事务已处理完毕
 */
public record StreamPosition(long lsn, int sequence) implements Comparable<StreamPosition> {

    /** 从未写过进度时的起点 */
    public static final StreamPosition BEGINNING = new StreamPosition(0L, 0);

    public static StreamPosition endOf(long lsn) {
        return new StreamPosition(lsn, Integer.MAX_VALUE);
    }

    /**
     * 解析 PostgreSQL 的 "XXX/XXX" 表示，可带 "#序号" 后缀
     */
    public static StreamPosition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("空的位置字符串");
        }
        String lsnPart = text;
        int sequence = Integer.MAX_VALUE;
        int hash = text.indexOf('#');
        if (hash >= 0) {
            lsnPart = text.substring(0, hash);
            sequence = Integer.parseInt(text.substring(hash + 1));
        }
        int slash = lsnPart.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("非法的 LSN: " + text);
        }
        long hi = Long.parseLong(lsnPart.substring(0, slash), 16);
        long lo = Long.parseLong(lsnPart.substring(slash + 1), 16);
        return new StreamPosition((hi << 32) | lo, sequence);
    }

    public boolean isBeginning() {
        return lsn == 0L && sequence == 0;
    }

    public boolean isAfter(StreamPosition other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(StreamPosition other) {
        return compareTo(other) < 0;
    }

    public static StreamPosition max(StreamPosition a, StreamPosition b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static StreamPosition min(StreamPosition a, StreamPosition b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public String lsnString() {
        return String.format("%X/%X", lsn >>> 32, lsn & 0xFFFFFFFFL);
    }

    @Override
    public int compareTo(StreamPosition o) {
        int c = Long.compareUnsigned(lsn, o.lsn);
        return c != 0 ? c : Integer.compare(sequence, o.sequence);
    }

    @Override
    public String toString() {
        return sequence == Integer.MAX_VALUE ? lsnString() : lsnString() + "#" + sequence;
    }
}
