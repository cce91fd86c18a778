package com.humasol.followup.application.controller.followup.mapper;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.application.controller.followup.CreateFollowupJobRequest;
import com.humasol.followup.application.controller.followup.FollowupJobResponse;
import com.humasol.followup.application.controller.followup.PeriodRequest;
import com.humasol.followup.application.controller.followup.PeriodResponse;
import com.humasol.followup.application.controller.followup.SubscriberRequest;
import com.humasol.followup.application.controller.followup.SubscriberResponse;
import com.humasol.followup.application.controller.followup.UpdateFollowupJobRequest;
import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.followup.FollowupJob;
import com.humasol.followup.domain.followup.FollowupJobUpdate;
import com.humasol.followup.domain.followup.NewFollowupJob;
import com.humasol.followup.domain.followup.Period;
import com.humasol.followup.domain.followup.PeriodValues;
import com.humasol.followup.domain.followup.Task;
import com.humasol.followup.domain.followup.TimeUnit;
import com.humasol.followup.domain.person.Person;
import com.humasol.followup.domain.person.PersonValues;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface FollowupJobRequestResponseMapper {

    PeriodValues toValues(PeriodRequest request);

    PersonValues toValues(SubscriberRequest request);

    NewFollowupJob toNewJob(CreateFollowupJobRequest request);

    FollowupJobUpdate toUpdate(UpdateFollowupJobRequest request);

    @Mapping(target = "startDate", source = "start")
    @Mapping(target = "endDate", source = "end")
    PeriodResponse toResponse(Period period);

    SubscriberResponse toResponse(Person person);

    default TimeUnit toTimeUnit(String unit) {
        return unit == null ? null : TimeUnit.fromString(unit);
    }

    default FollowupJobType toJobType(String type) {
        try {
            return FollowupJobType.fromString(type);
        } catch (IllegalArgumentException e) {
            throw InvalidFieldException.of("type", e.getMessage());
        }
    }

    default FollowupJobResponse toResponse(FollowupJob job) {
        var task = job instanceof Task t ? t : null;
        return new FollowupJobResponse(
                job.getId(),
                job.type(),
                job.getProjectId(),
                toResponse(job.getSubscriber()),
                job.getPeriods().stream().map(this::toResponse).toList(),
                job.getLastNotification(),
                task != null ? task.getName() : null,
                task != null ? task.getFunction() : null,
                job.shouldNotify());
    }
}
