package com.fundrecon.reconciliation.store;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive range of due dates.
 */
@Value
public class DateWindow {

    LocalDate from;
    LocalDate to;

    public DateWindow(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
        this.from = from;
        this.to = to;
    }

    public static DateWindow around(LocalDate date, int days) {
        return new DateWindow(date.minusDays(days), date.plusDays(days));
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(from) && !date.isAfter(to);
    }
}
