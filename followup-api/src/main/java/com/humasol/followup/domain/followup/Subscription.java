package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.domain.person.Person;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * Keeps a person updated about a project's operations. Adds nothing to {@link FollowupJob};
 * {@code name} and {@code function} in an update are ignored.
 */
public final class Subscription extends FollowupJob {

    @Builder
    public Subscription(
            Person subscriber, List<Period> periods, LocalDate lastNotification, Long projectId, Clock clock) {
        super(subscriber, periods, lastNotification, projectId, clock);
    }

    private Subscription(
            Long id, Long projectId, Person subscriber, List<Period> periods, LocalDate lastNotification, Clock clock) {
        super(id, projectId, subscriber, periods, lastNotification, clock);
    }

    public static Subscription restore(
            Long id, Long projectId, Person subscriber, List<Period> periods, LocalDate lastNotification, Clock clock) {
        return new Subscription(id, projectId, subscriber, periods, lastNotification, clock);
    }

    @Override
    public FollowupJobType type() {
        return FollowupJobType.SUBSCRIPTION;
    }

    @Override
    public String toString() {
        return "Subscription(id=" + getId() + ", subscriber=" + getSubscriber().getEmail()
                + ", periods=" + getPeriods() + ", lastNotification=" + getLastNotification() + ")";
    }
}
