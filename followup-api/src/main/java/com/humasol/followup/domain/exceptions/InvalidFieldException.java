package com.humasol.followup.domain.exceptions;

import lombok.Getter;

/**
 * Raised when a value handed to the follow-up model is structurally or semantically invalid.
 * {@link #getField()} names the offending field so callers can attach the message to it.
 */
@Getter
public class InvalidFieldException extends IllegalArgumentException {

    private final String field;

    private InvalidFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static InvalidFieldException of(String field, String reason) {
        return new InvalidFieldException(field, "Invalid '" + field + "': " + reason);
    }
}
