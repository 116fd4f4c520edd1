package com.cubelayer.sql;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * 时间值解析。所有时间按无时区的本地时间处理；带偏移量的输入先换算到 UTC。
 */
public final class TimeValues {
    private TimeValues() {
    }

    /**
     * 支持 2024-01-15、2024-01-15T10:00:00、2024-01-15 10:00:00、2024-01-15T10:00:00Z / +08:00
     *
     * @throws DateTimeParseException 无法识别的格式
     */
    public static LocalDateTime parse(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value == null) {
            throw new DateTimeParseException("null is not a timestamp", "null", 0);
        }
        String text = value.toString().trim();
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        String iso = text.replace(' ', 'T');
        try {
            return LocalDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
    }
}
