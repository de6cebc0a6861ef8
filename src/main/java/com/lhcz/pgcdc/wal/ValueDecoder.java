package com.lhcz.pgcdc.wal;

import com.lhcz.pgcdc.error.DecodeException;
import com.lhcz.pgcdc.model.ColumnDescriptor;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.UUID;

/**
 * 按列的逻辑类型解析 pgoutput 行镜像中的值
 * <p>
 * 文本格式遵循 PostgreSQL 的默认输出 (DateStyle=ISO, bytea_output=hex)，
 * 二进制格式遵循各类型的 send 函数。
 */
public final class ValueDecoder {

    /** PostgreSQL 纪元 2000-01-01 00:00:00 UTC */
    static final Instant PG_EPOCH = Instant.parse("2000-01-01T00:00:00Z");
    private static final LocalDate PG_EPOCH_DATE = LocalDate.of(2000, 1, 1);

    private static final DateTimeFormatter LOCAL_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private static final long MICROS_PER_DAY = 86_400_000_000L;

    private static final DateTimeFormatter OFFSET_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(LOCAL_TIMESTAMP)
            .appendOffset("+HH:mm:ss", "Z")
            .toFormatter();

    private ValueDecoder() {
    }

    public static Object decodeText(ColumnDescriptor column, String text) {
        try {
            return switch (column.type()) {
                case BOOLEAN -> parseBoolean(text);
                case SMALLINT -> Short.parseShort(text);
                case INTEGER -> Integer.parseInt(text);
                case BIGINT -> Long.parseLong(text);
                case REAL -> Float.parseFloat(text);
                case DOUBLE -> Double.parseDouble(text);
                case NUMERIC -> parseNumeric(text);
                case TEXT, JSON -> text;
                case DATE -> LocalDate.parse(rejectInfinity(text));
                case TIME -> parseTime(text);
                case TIMESTAMP -> LocalDateTime.parse(rejectInfinity(text), LOCAL_TIMESTAMP);
                case TIMESTAMPTZ -> OffsetDateTime.parse(rejectInfinity(text), OFFSET_TIMESTAMP);
                case UUID -> UUID.fromString(text);
                case BYTES -> parseHexBytes(text);
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new DecodeException("列 " + column.name() + " (" + column.type() + ") 无法解析值: " + text, e);
        }
    }

    public static Object decodeBinary(ColumnDescriptor column, byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        try {
            return switch (column.type()) {
                case BOOLEAN -> buf.get() != 0;
                case SMALLINT -> buf.getShort();
                case INTEGER -> buf.getInt();
                // oid 类型是 4 字节无符号数
                case BIGINT -> bytes.length == 4 ? Integer.toUnsignedLong(buf.getInt()) : buf.getLong();
                case REAL -> buf.getFloat();
                case DOUBLE -> buf.getDouble();
                case TEXT -> new String(bytes, StandardCharsets.UTF_8);
                // jsonb 的二进制格式带 1 字节版本号
                case JSON -> column.typeOid() == 3802 && bytes.length > 0 && bytes[0] == 1
                        ? new String(bytes, 1, bytes.length - 1, StandardCharsets.UTF_8)
                        : new String(bytes, StandardCharsets.UTF_8);
                case DATE -> PG_EPOCH_DATE.plusDays(buf.getInt());
                case TIME -> timeOfDay(buf.getLong());
                case TIMESTAMP -> LocalDateTime.ofInstant(fromPgMicros(buf.getLong()), ZoneOffset.UTC);
                case TIMESTAMPTZ -> OffsetDateTime.ofInstant(fromPgMicros(buf.getLong()), ZoneOffset.UTC);
                case UUID -> new UUID(buf.getLong(), buf.getLong());
                case BYTES -> Arrays.copyOf(bytes, bytes.length);
                case NUMERIC -> throw new DecodeException("列 " + column.name() + ": 不支持 numeric 的二进制格式");
            };
        } catch (java.nio.BufferUnderflowException e) {
            throw new DecodeException("列 " + column.name() + " (" + column.type() + ") 二进制值长度不足: " + bytes.length, e);
        }
    }

    /**
     * 自 2000-01-01 起的微秒数
     */
    public static Instant fromPgMicros(long micros) {
        return PG_EPOCH.plus(micros, ChronoUnit.MICROS);
    }

    private static Boolean parseBoolean(String text) {
        return switch (text) {
            case "t", "true" -> Boolean.TRUE;
            case "f", "false" -> Boolean.FALSE;
            default -> throw new NumberFormatException("非法的布尔值");
        };
    }

    private static BigDecimal parseNumeric(String text) {
        if ("NaN".equals(text) || text.endsWith("Infinity")) {
            throw new NumberFormatException("目标端无法表示 numeric 特殊值");
        }
        return new BigDecimal(text);
    }

    /**
     * PostgreSQL 的 time 允许 24:00:00，java.time 没有对应值，按一天的最后时刻处理
     */
    private static LocalTime parseTime(String text) {
        if (text.startsWith("24:00:00")) {
            return LocalTime.MAX;
        }
        return LocalTime.parse(text);
    }

    private static LocalTime timeOfDay(long micros) {
        if (micros == MICROS_PER_DAY) {
            return LocalTime.MAX;
        }
        return LocalTime.ofNanoOfDay(micros * 1000L);
    }

    private static String rejectInfinity(String text) {
        if (text.endsWith("infinity") || text.endsWith(" BC")) {
            throw new DateTimeParseException("目标端无法表示该时间值", text, 0);
        }
        return text;
    }

    private static byte[] parseHexBytes(String text) {
        if (!text.startsWith("\\x")) {
            throw new NumberFormatException("bytea 需要 hex 输出格式 (bytea_output=hex)");
        }
        int len = (text.length() - 2) / 2;
        if ((text.length() - 2) % 2 != 0) {
            throw new NumberFormatException("bytea hex 长度为奇数");
        }
        byte[] out = new byte[len];
        for (int i = 0; i < len; i++) {
            int hi = Character.digit(text.charAt(2 + i * 2), 16);
            int lo = Character.digit(text.charAt(3 + i * 2), 16);
            if (hi < 0 || lo < 0) {
                throw new NumberFormatException("bytea 包含非十六进制字符");
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
