package com.humasol.followup.application.controller.followup;

import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;

public record UpdateFollowupJobRequest(
        LocalDate lastNotification,
        @Valid SubscriberRequest subscriber,
        List<@Valid PeriodRequest> periods,
        String name,
        String function) {}
