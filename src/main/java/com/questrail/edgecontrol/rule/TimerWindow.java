package com.questrail.edgecontrol.rule;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * TimerWindow
 * -----------------------------------------------------------------------------
 * A daily time-of-day window restricted to a set of weekdays. Times are minutes
 * since midnight, both ends inclusive.
 *
 * <h2>Windows that cross midnight</h2>
 * When {@code start > end} the window is {@code [start, 24:00) ∪ [00:00, end]}.
 * Only the current weekday is checked against {@link #days()}: a Monday
 * 22:00-06:00 window is active on Monday 23:00 and on Monday 03:00, and is not
 * active on Tuesday 03:00.
 */
public record TimerWindow(String name, int startMinute, int endMinute, Set<DayOfWeek> days, boolean enabled) {

    private static final int MINUTES_PER_DAY = 24 * 60;

    public TimerWindow {
        Objects.requireNonNull(days, "days");
        checkMinute(startMinute, "startMinute");
        checkMinute(endMinute, "endMinute");
        name = name == null ? "" : name;
        days = days.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(days));
    }

    public static TimerWindow of(String name, LocalTime start, LocalTime end, Set<DayOfWeek> days) {
        return new TimerWindow(name,
                start.getHour() * 60 + start.getMinute(),
                end.getHour() * 60 + end.getMinute(),
                days,
                true);
    }

    public static TimerWindow everyDay(String name, LocalTime start, LocalTime end) {
        return of(name, start, end, EnumSet.allOf(DayOfWeek.class));
    }

    public boolean crossesMidnight() {
        return startMinute > endMinute;
    }

    public boolean isActiveAt(LocalDateTime localTime) {
        if (!enabled || !days.contains(localTime.getDayOfWeek())) {
            return false;
        }
        int now = localTime.getHour() * 60 + localTime.getMinute();
        if (startMinute <= endMinute) {
            return now >= startMinute && now <= endMinute;
        }
        return now >= startMinute || now <= endMinute;
    }

    private static void checkMinute(int minute, String field) {
        if (minute < 0 || minute >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException(field + " must be within [0, 1440): " + minute);
        }
    }
}
