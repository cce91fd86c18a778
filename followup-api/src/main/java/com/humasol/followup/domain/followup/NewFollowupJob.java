package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.domain.person.PersonValues;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * Description of a follow-up job to create. {@code name} and {@code function} only apply to
 * tasks.
 */
@Builder(toBuilder = true)
public record NewFollowupJob(
        FollowupJobType type,
        Long projectId,
        PersonValues subscriber,
        List<PeriodValues> periods,
        LocalDate lastNotification,
        String name,
        String function) {}
