package com.humasol.followup.application.controller.followup;

public record SubscriberResponse(Long id, String name, String email, String phone) {}
