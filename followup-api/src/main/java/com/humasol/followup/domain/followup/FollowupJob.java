package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.domain.exceptions.IllegalJobStateException;
import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.person.Person;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Follow-up work attached to a finished project: a subscriber, the periods during which the
 * work is active, and the date the subscriber was last notified.
 *
 * <p>No two periods of a job may be active at the same time, and none may have expired when it
 * is added. An external scheduler asks {@link #shouldNotify()} and, after notifying, moves
 * {@link #getLastNotification()} forward; checking never changes the job.
 */
@Getter
public abstract sealed class FollowupJob permits Subscription, Task {

    private Long id;
    private final Long projectId;
    private final Person subscriber;
    private List<Period> periods;
    private LocalDate lastNotification;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    protected FollowupJob(
            Person subscriber, List<Period> periods, LocalDate lastNotification, Long projectId, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        var today = today();
        if (projectId == null) {
            throw InvalidFieldException.of("projectId", "a follow-up job must belong to a project");
        }
        if (subscriber == null) {
            throw InvalidFieldException.of("subscriber", "must not be null");
        }
        if (!areLegalPeriods(periods, today)) {
            throw InvalidFieldException.of("periods",
                    "must be a non-empty list of periods that have not ended and do not overlap");
        }
        if (!isLegalLastNotification(lastNotification, today)) {
            throw InvalidFieldException.of("lastNotification", lastNotification + " is after today (" + today + ")");
        }
        this.projectId = projectId;
        this.subscriber = subscriber;
        this.periods = new ArrayList<>(periods);
        this.lastNotification = lastNotification;
    }

    /**
     * Rehydrates a stored job as-is. Stored periods may have expired since they were saved, so
     * none of the construction rules are re-checked.
     */
    protected FollowupJob(
            Long id, Long projectId, Person subscriber, List<Period> periods, LocalDate lastNotification, Clock clock) {
        this.id = id;
        this.projectId = projectId;
        this.subscriber = subscriber;
        this.periods = new ArrayList<>(periods);
        this.lastNotification = lastNotification;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public abstract FollowupJobType type();

    /**
     * Periods are legal together when there is at least one, none has ended by {@code today},
     * and no period starts while another one that started no later is still running.
     */
    public static boolean areLegalPeriods(List<Period> periods, LocalDate today) {
        if (periods == null || periods.isEmpty()) {
            return false;
        }
        if (periods.stream().anyMatch(p -> p == null || p.hasPast(today))) {
            return false;
        }
        for (int i = 0; i < periods.size() - 1; i++) {
            for (int j = i + 1; j < periods.size(); j++) {
                if (overlap(periods.get(i), periods.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean isLegalLastNotification(LocalDate lastNotification, LocalDate today) {
        return lastNotification == null || !lastNotification.isAfter(today);
    }

    private static boolean overlap(Period p, Period q) {
        return (!p.getStart().isAfter(q.getStart()) && !p.hasPast(q.getStart()))
                || (!q.getStart().isAfter(p.getStart()) && !q.hasPast(p.getStart()));
    }

    public List<Period> getPeriods() {
        return Collections.unmodifiableList(periods);
    }

    public boolean shouldNotify() {
        var today = today();
        return periods.stream().anyMatch(p -> p.shouldUpdate(lastNotification, today));
    }

    /**
     * Drops every period that has ended before today. The remaining periods keep their order.
     * This may leave the job without periods; such a job never notifies.
     */
    public void cleanPeriods() {
        var today = today();
        periods.removeIf(p -> p.hasPast(today));
    }

    public boolean isValidPeriod(Period candidate) {
        var extended = new ArrayList<>(periods);
        extended.add(candidate);
        return areLegalPeriods(extended, today());
    }

    public void addPeriod(Period period) {
        if (!isValidPeriod(period)) {
            throw InvalidFieldException.of("periods", "new period " + period
                    + " has ended or overlaps with an existing period");
        }
        periods.add(period);
    }

    public void removePeriod(Period period) {
        if (!periods.contains(period)) {
            return;
        }
        if (periods.size() == 1) {
            throw IllegalJobStateException.onlyPeriodRemoved();
        }
        periods.remove(period);
    }

    /**
     * Moves the last notification date forward. It can neither go back in time, be cleared
     * once set, nor lie in the future.
     */
    public void setLastNotification(LocalDate date) {
        if (lastNotification != null && (date == null || date.isBefore(lastNotification))) {
            throw IllegalJobStateException.lastNotificationMovedBack(lastNotification, date);
        }
        if (!isLegalLastNotification(date, today())) {
            throw InvalidFieldException.of("lastNotification", date + " is after today (" + today() + ")");
        }
        lastNotification = date;
    }

    /**
     * Applies {@code changes} as a single unit. If any part is rejected, every field touched so
     * far, including those of the subscriber and of existing periods, is restored before the
     * exception propagates.
     */
    public FollowupJob update(FollowupJobUpdate changes) {
        Objects.requireNonNull(changes, "changes");
        var restore = snapshot();
        try {
            applyChanges(changes);
        } catch (RuntimeException e) {
            restore.run();
            throw e;
        }
        return this;
    }

    protected void applyChanges(FollowupJobUpdate changes) {
        if (changes.lastNotification() != null) {
            setLastNotification(changes.lastNotification());
        }
        if (changes.subscriber() != null) {
            subscriber.update(changes.subscriber());
        }
        if (changes.periods() != null) {
            mergePeriods(changes.periods());
        }
    }

    protected Runnable snapshot() {
        var savedLastNotification = lastNotification;
        var savedPeriods = new ArrayList<>(periods);
        var periodRestores = periods.stream().map(Period::snapshot).toList();
        var subscriberRestore = subscriber.snapshot();
        return () -> {
            lastNotification = savedLastNotification;
            periods = savedPeriods;
            periodRestores.forEach(Runnable::run);
            subscriberRestore.run();
        };
    }

    protected LocalDate today() {
        return LocalDate.now(clock);
    }

    private void mergePeriods(List<PeriodValues> incoming) {
        if (incoming.stream().anyMatch(values -> values == null || values.startDate() == null)) {
            throw InvalidFieldException.of("periods.startDate", "every period needs a start date");
        }
        var merged = MergeUpdates.mergeByKey(
                periods,
                incoming,
                Period::getStart,
                PeriodValues::startDate,
                Period::update,
                PeriodValues::toPeriod);
        if (!areLegalPeriods(merged, today())) {
            throw InvalidFieldException.of("periods",
                    "updated periods must not be empty, ended or overlapping");
        }
        periods = merged;
    }
}
