package com.humasol.followup.application.controller.followup;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Period as sent by clients. On update, {@code startDate} identifies which stored period the
 * other fields apply to.
 */
public record PeriodRequest(
        Integer interval,
        String unit,
        @NotNull LocalDate startDate,
        LocalDate endDate) {}
