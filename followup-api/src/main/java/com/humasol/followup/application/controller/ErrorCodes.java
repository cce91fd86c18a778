package com.humasol.followup.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String FOLLOWUP_JOB_NOT_FOUND = "FOLLOWUP_JOB_NOT_FOUND";
    public static final String INVALID_FIELD = "INVALID_FIELD";
    public static final String ILLEGAL_JOB_STATE = "ILLEGAL_JOB_STATE";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
