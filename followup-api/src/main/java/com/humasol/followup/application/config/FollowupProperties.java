package com.humasol.followup.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "followup")
public record FollowupProperties(@Valid @NotNull Notification notification) {

    public record Notification(
            @NotBlank String cron,
            @NotBlank String timezone,
            @NotBlank @Email String sender
    ) {}
}
