package com.humasol.followup.domain.followup;

import com.humasol.followup.domain.person.PersonValues;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * Partial update of a follow-up job; {@code null} fields are left unchanged.
 * {@code name} and {@code function} only apply to tasks.
 */
@Builder(toBuilder = true)
public record FollowupJobUpdate(
        LocalDate lastNotification,
        PersonValues subscriber,
        List<PeriodValues> periods,
        String name,
        String function) {}
