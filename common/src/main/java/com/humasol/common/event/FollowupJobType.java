package com.humasol.common.event;

import java.util.Locale;

public enum FollowupJobType {
    SUBSCRIPTION,
    TASK;

    public static FollowupJobType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Follow-up job type must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown follow-up job type: " + value, e);
        }
    }
}
