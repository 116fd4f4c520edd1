package com.cubelayer.sql;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * 时间粒度。每个桶是左闭右开区间 [truncate(t), next(t))；周以 ISO 周一为起点。
 */
public enum TimeGrain {
    SECOND("second"),
    MINUTE("minute"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year");

    private final String declaredName;

    TimeGrain(String declaredName) {
        this.declaredName = declaredName;
    }

    public String getDeclaredName() {
        return declaredName;
    }

    public static TimeGrain fromDeclared(String value) {
        if (value == null) {
            return null;
        }
        for (TimeGrain grain : values()) {
            if (grain.declaredName.equalsIgnoreCase(value.trim())) {
                return grain;
            }
        }
        return null;
    }

    public LocalDateTime truncate(LocalDateTime value) {
        switch (this) {
            case SECOND:
                return value.truncatedTo(ChronoUnit.SECONDS);
            case MINUTE:
                return value.truncatedTo(ChronoUnit.MINUTES);
            case HOUR:
                return value.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return value.truncatedTo(ChronoUnit.DAYS);
            case WEEK:
                return value.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
            case MONTH:
                return value.toLocalDate().withDayOfMonth(1).atStartOfDay();
            case QUARTER:
                int firstMonth = (value.getMonthValue() - 1) / 3 * 3 + 1;
                return LocalDate.of(value.getYear(), firstMonth, 1).atStartOfDay();
            case YEAR:
                return LocalDate.of(value.getYear(), 1, 1).atStartOfDay();
            default:
                throw new IllegalStateException("unknown grain " + this);
        }
    }

    /**
     * value 所在桶的结束（不含），即下一个桶的起点
     */
    public LocalDateTime next(LocalDateTime value) {
        LocalDateTime start = truncate(value);
        switch (this) {
            case SECOND:
                return start.plusSeconds(1);
            case MINUTE:
                return start.plusMinutes(1);
            case HOUR:
                return start.plusHours(1);
            case DAY:
                return start.plusDays(1);
            case WEEK:
                return start.plusWeeks(1);
            case MONTH:
                return start.plusMonths(1);
            case QUARTER:
                return start.plusMonths(3);
            case YEAR:
                return start.plusYears(1);
            default:
                throw new IllegalStateException("unknown grain " + this);
        }
    }
}
