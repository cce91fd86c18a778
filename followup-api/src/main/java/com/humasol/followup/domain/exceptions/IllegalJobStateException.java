package com.humasol.followup.domain.exceptions;

import java.time.LocalDate;

public class IllegalJobStateException extends IllegalStateException {

    private IllegalJobStateException(String message) {
        super(message);
    }

    public static IllegalJobStateException lastNotificationMovedBack(LocalDate current, LocalDate requested) {
        return new IllegalJobStateException(
                "Last notification cannot move from " + current + " back to " + requested);
    }

    public static IllegalJobStateException onlyPeriodRemoved() {
        return new IllegalJobStateException("Cannot remove the only period of a follow-up job");
    }
}
