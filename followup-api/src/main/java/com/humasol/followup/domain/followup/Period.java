package com.humasol.followup.domain.followup;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Window during which a follow-up job is active: every {@code interval} {@code unit}s,
 * from {@code start} up to and including {@code end}. A period without end never expires.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Period {

    private Long id;
    private int interval;
    private TimeUnit unit;
    private LocalDate start;
    private LocalDate end;

    public Period(Integer interval, TimeUnit unit, LocalDate start, LocalDate end) {
        requireLegalInterval(interval);
        requireLegalUnit(unit);
        requireLegalStart(start);
        if (end != null && !end.isAfter(start)) {
            throw InvalidFieldException.of("end", "end date " + end + " must be after start date " + start);
        }
        this.interval = interval;
        this.unit = unit;
        this.start = start;
        this.end = end;
    }

    public Period(Integer interval, TimeUnit unit, LocalDate start) {
        this(interval, unit, start, null);
    }

    /**
     * Rebuilds a stored period without validation; stored periods may have expired since.
     */
    public static Period restore(Long id, int interval, TimeUnit unit, LocalDate start, LocalDate end) {
        return new Period(id, interval, unit, start, end);
    }

    public boolean isApplicable(LocalDate day) {
        if (day == null) {
            return false;
        }
        return !day.isBefore(start) && (end == null || !day.isAfter(end));
    }

    public boolean hasPast(LocalDate day) {
        return end != null && day.isAfter(end);
    }

    /**
     * Whether {@code today} is the natural start of a cycle: Monday for weekly periods, the first
     * of the month for monthly ones. Yearly periods have no such day and never fire on a cold start.
     */
    public boolean isFirstCheckDay(LocalDate today) {
        return switch (unit) {
            case WEEK -> today.getDayOfWeek() == DayOfWeek.MONDAY;
            case MONTH -> today.getDayOfMonth() == 1;
            case YEAR -> false;
        };
    }

    /**
     * Decides whether the job owning this period should notify its subscriber today.
     *
     * <p>Without a notification inside this window yet, only the first check day of a cycle
     * fires. Once the window was active at {@code lastNotification}, it fires as soon as
     * {@code interval} whole units have elapsed since then, counted on the calendar.
     */
    public boolean shouldUpdate(LocalDate lastNotification, LocalDate today) {
        if (lastNotification == null || lastNotification.isBefore(start)) {
            return isFirstCheckDay(today);
        }
        if (!isApplicable(lastNotification)) {
            return false;
        }

        var elapsed = java.time.Period.between(lastNotification, today).normalized();
        return switch (unit) {
            case YEAR -> elapsed.getYears() >= interval;
            case MONTH -> elapsed.toTotalMonths() >= interval;
            case WEEK -> ChronoUnit.DAYS.between(lastNotification, today) / 7 >= interval;
        };
    }

    /**
     * Overwrites every non-null field of {@code changes}. The interval is the only field that can
     * be rejected and it is checked before anything is assigned. The end date is not compared
     * against the start date here.
     */
    public Period update(PeriodValues changes) {
        if (changes.interval() != null) {
            requireLegalInterval(changes.interval());
            interval = changes.interval();
        }
        if (changes.unit() != null) {
            unit = changes.unit();
        }
        if (changes.startDate() != null) {
            start = changes.startDate();
        }
        if (changes.endDate() != null) {
            end = changes.endDate();
        }
        return this;
    }

    Runnable snapshot() {
        var savedInterval = interval;
        var savedUnit = unit;
        var savedStart = start;
        var savedEnd = end;
        return () -> {
            interval = savedInterval;
            unit = savedUnit;
            start = savedStart;
            end = savedEnd;
        };
    }

    private static void requireLegalInterval(Integer interval) {
        if (interval == null || interval <= 0) {
            throw InvalidFieldException.of("interval", "must be a positive number of time units, got " + interval);
        }
    }

    private static void requireLegalUnit(TimeUnit unit) {
        if (unit == null) {
            throw InvalidFieldException.of("unit", "must be one of week, month or year");
        }
    }

    private static void requireLegalStart(LocalDate start) {
        if (start == null) {
            throw InvalidFieldException.of("start", "must be a date");
        }
    }
}
