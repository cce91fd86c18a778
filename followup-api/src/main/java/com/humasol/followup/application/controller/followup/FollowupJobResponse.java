package com.humasol.followup.application.controller.followup;

import com.humasol.common.event.FollowupJobType;
import java.time.LocalDate;
import java.util.List;

public record FollowupJobResponse(
        Long id,
        FollowupJobType type,
        Long projectId,
        SubscriberResponse subscriber,
        List<PeriodResponse> periods,
        LocalDate lastNotification,
        String name,
        String function,
        boolean notificationDue) {}
