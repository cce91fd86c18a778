package com.humasol.followup.domain.followup;

import java.time.LocalDate;
import lombok.Builder;

/**
 * Raw period fields as supplied by a form or request. Used both to construct a new
 * {@link Period} and as a partial update, where a {@code null} field means "leave unchanged".
 * {@code startDate} identifies the period when a job's periods are merge-updated.
 */
@Builder(toBuilder = true)
public record PeriodValues(Integer interval, TimeUnit unit, LocalDate startDate, LocalDate endDate) {

    public Period toPeriod() {
        return new Period(interval, unit, startDate, endDate);
    }
}
