package com.asiainfo.semantic.core.anchor;

import com.asiainfo.semantic.core.filter.ColumnPredicate;
import com.asiainfo.semantic.core.filter.Predicates;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * 日期窗口，两端均包含
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * [anchor - n, anchor]
     */
    public static DateWindow lastDays(LocalDate anchor, int days) {
        return new DateWindow(anchor.minusDays(days), anchor);
    }

    /**
     * 上一个完整自然月，锚点缺失时的兜底窗口
     */
    public static DateWindow lastFullCalendarMonth(LocalDate today) {
        YearMonth previous = YearMonth.from(today).minusMonths(1);
        return new DateWindow(previous.atDay(1), previous.atEndOfMonth());
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public ColumnPredicate toPredicate() {
        return Predicates.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
