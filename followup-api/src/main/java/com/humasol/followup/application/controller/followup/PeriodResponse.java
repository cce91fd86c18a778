package com.humasol.followup.application.controller.followup;

import com.humasol.followup.domain.followup.TimeUnit;
import java.time.LocalDate;

public record PeriodResponse(Long id, int interval, TimeUnit unit, LocalDate startDate, LocalDate endDate) {}
