package org.nowstart.pairsim.util;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Weekday stepping. Exchange holidays are not modelled; only Saturday and Sunday are skipped.
 */
public final class TradingCalendar {

    private TradingCalendar() {
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public static LocalDate addTradingDays(LocalDate start, int tradingDays) {
        if (start == null) {
            throw new IllegalArgumentException("start date is required");
        }
        if (tradingDays < 0) {
            throw new IllegalArgumentException("tradingDays must be >= 0");
        }
        LocalDate cursor = start;
        int remaining = tradingDays;
        while (remaining > 0) {
            cursor = cursor.plusDays(1);
            if (isTradingDay(cursor)) {
                remaining--;
            }
        }
        return cursor;
    }
}
