package com.humasol.followup.application.controller.followup;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record CreateFollowupJobRequest(
        @NotBlank
        String type,

        @NotNull
        Long projectId,

        @NotNull @Valid
        SubscriberRequest subscriber,

        @NotEmpty
        List<@Valid PeriodRequest> periods,

        LocalDate lastNotification,
        String name,
        String function
) {
}
