package com.climate.quality.model;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;

/**
 * 时间戳解析工具。
 * 将观测记录中各种形式的时间值统一转换为 {@link Timestamp}。
 *
 * 支持的输入：
 * - Timestamp / java.util.Date / Instant / LocalDateTime / LocalDate / OffsetDateTime
 * - Number：按 epoch 毫秒解释
 * - String：ISO-8601（含时区偏移）、"yyyy-MM-dd HH:mm[:ss[.fff]]"、"yyyy/MM/dd HH:mm[:ss]"、
 *   "MM/dd/yyyy[ HH:mm[:ss]]"、"yyyy-MM-dd"、"yyyy/MM/dd"、"yyyy-MM"、"yyyy"
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            withOptionalSeconds("yyyy-MM-dd HH:mm"),
            withOptionalSeconds("yyyy/MM/dd HH:mm"),
            withOptionalSeconds("MM/dd/yyyy HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy-MM")
                    .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                    .toFormatter(),
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy")
                    .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                    .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                    .toFormatter()
    );

    private TimestampParser() {}

    /**
     * 解析任意时间值。
     *
     * @param value 原始值
     * @return 解析结果；value为null或无法解析时返回null
     */
    public static Timestamp parse(Object value) {
        if (value == null) return null;
        if (value instanceof Timestamp) return (Timestamp) value;
        if (value instanceof Date) return new Timestamp(((Date) value).getTime());
        if (value instanceof Instant) return Timestamp.from((Instant) value);
        if (value instanceof LocalDateTime) return Timestamp.valueOf((LocalDateTime) value);
        if (value instanceof LocalDate) return Timestamp.valueOf(((LocalDate) value).atStartOfDay());
        if (value instanceof OffsetDateTime) return Timestamp.from(((OffsetDateTime) value).toInstant());
        if (value instanceof Number) return new Timestamp(((Number) value).longValue());
        if (value instanceof String) return parseText(((String) value).trim());
        return null;
    }

    /**
     * 判断值是否可被解析为时间戳
     */
    public static boolean isParseable(Object value) {
        return parse(value) != null;
    }

    private static Timestamp parseText(String text) {
        if (text.isEmpty()) return null;

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime dateTime = tryParseDateTime(text, format);
            if (dateTime != null) return Timestamp.valueOf(dateTime);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParseDate(text, format);
            if (date != null) return Timestamp.valueOf(date.atStartOfDay());
        }
        // 带时区偏移或UTC瞬时值
        try {
            return Timestamp.from(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Timestamp.from(Instant.parse(text));
            } catch (DateTimeParseException again) {
                return null;
            }
        }
    }

    private static LocalDateTime tryParseDateTime(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate tryParseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter withOptionalSeconds(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .optionalStart()
                .appendPattern(":ss")
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                .optionalEnd()
                .optionalEnd()
                .toFormatter();
    }
}
