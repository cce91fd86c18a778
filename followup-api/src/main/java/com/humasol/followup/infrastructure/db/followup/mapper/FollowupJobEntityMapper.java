package com.humasol.followup.infrastructure.db.followup.mapper;

import com.humasol.followup.domain.followup.FollowupJob;
import com.humasol.followup.domain.followup.Period;
import com.humasol.followup.domain.followup.Subscription;
import com.humasol.followup.domain.followup.Task;
import com.humasol.followup.infrastructure.db.followup.FollowupJobEntity;
import com.humasol.followup.infrastructure.db.followup.PeriodEntity;
import com.humasol.followup.infrastructure.db.person.mapper.PersonEntityMapper;
import java.time.Clock;
import java.util.ArrayList;
import org.mapstruct.Mapper;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Maps follow-up jobs to their table rows and back. Jobs read from the database are restored
 * without re-running construction checks, since their periods may have expired since.
 */
@Mapper(componentModel = "spring")
public abstract class FollowupJobEntityMapper {

    @Autowired
    protected PersonEntityMapper personMapper;

    public abstract PeriodEntity toEntity(Period period);

    public FollowupJobEntity toEntity(FollowupJob job) {
        var entity = FollowupJobEntity.builder()
                .id(job.getId())
                .type(job.type())
                .projectId(job.getProjectId())
                .subscriber(personMapper.toEntity(job.getSubscriber()))
                .periods(new ArrayList<>(job.getPeriods().stream().map(this::toEntity).toList()))
                .lastNotification(job.getLastNotification());
        if (job instanceof Task task) {
            entity.name(task.getName()).function(task.getFunction());
        }
        return entity.build();
    }

    public FollowupJob toDomain(FollowupJobEntity entity, Clock clock) {
        var subscriber = personMapper.toDomain(entity.getSubscriber());
        var periods = entity.getPeriods().stream().map(this::toDomain).toList();
        return switch (entity.getType()) {
            case SUBSCRIPTION -> Subscription.restore(
                    entity.getId(), entity.getProjectId(), subscriber, periods, entity.getLastNotification(), clock);
            case TASK -> Task.restore(
                    entity.getId(),
                    entity.getProjectId(),
                    subscriber,
                    periods,
                    entity.getLastNotification(),
                    entity.getName(),
                    entity.getFunction(),
                    clock);
        };
    }

    public Period toDomain(PeriodEntity entity) {
        return Period.restore(entity.getId(), entity.getInterval(), entity.getUnit(), entity.getStart(), entity.getEnd());
    }
}
