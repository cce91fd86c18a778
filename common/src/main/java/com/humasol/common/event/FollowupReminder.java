package com.humasol.common.event;

import java.time.LocalDate;
import java.util.Objects;
import lombok.Builder;

/**
 * Reminder sent to the subscriber of a follow-up job when one of its periods is due.
 * {@code taskName} and {@code taskFunction} are only set for tasks.
 */
@Builder(toBuilder = true)
public record FollowupReminder(
        Long jobId,
        FollowupJobType jobType,
        Long projectId,
        String recipientName,
        String recipientEmail,
        String taskName,
        String taskFunction,
        LocalDate previousNotification,
        LocalDate dueOn) {

    public FollowupReminder {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(recipientEmail, "recipientEmail");
        Objects.requireNonNull(dueOn, "dueOn");
    }

    public boolean isTask() {
        return jobType == FollowupJobType.TASK;
    }
}
