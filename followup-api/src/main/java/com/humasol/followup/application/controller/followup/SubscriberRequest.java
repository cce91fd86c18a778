package com.humasol.followup.application.controller.followup;

import jakarta.validation.constraints.NotBlank;

public record SubscriberRequest(String name, @NotBlank String email, String phone) {}
