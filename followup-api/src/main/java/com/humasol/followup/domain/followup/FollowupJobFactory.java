package com.humasol.followup.domain.followup;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.person.Person;
import com.humasol.followup.domain.person.PersonRepository;
import com.humasol.followup.domain.person.PersonValues;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds validated follow-up jobs from their description. A subscriber already known by e-mail
 * is reused as-is; otherwise a new person is created from the supplied values.
 */
@Component
@RequiredArgsConstructor
public class FollowupJobFactory {

    private final PersonRepository personRepository;
    private final Clock clock;

    public FollowupJob create(NewFollowupJob description) {
        if (description.type() == null) {
            throw InvalidFieldException.of("type", "must be one of SUBSCRIPTION or TASK");
        }
        var subscriber = resolveSubscriber(description.subscriber());
        var periods = toPeriods(description.periods());

        return switch (description.type()) {
            case SUBSCRIPTION -> Subscription.builder()
                    .subscriber(subscriber)
                    .periods(periods)
                    .lastNotification(description.lastNotification())
                    .projectId(description.projectId())
                    .clock(clock)
                    .build();
            case TASK -> Task.builder()
                    .subscriber(subscriber)
                    .periods(periods)
                    .name(description.name())
                    .function(description.function())
                    .lastNotification(description.lastNotification())
                    .projectId(description.projectId())
                    .clock(clock)
                    .build();
        };
    }

    private Person resolveSubscriber(PersonValues values) {
        if (values == null) {
            throw InvalidFieldException.of("subscriber", "must not be null");
        }
        return personRepository.findByEmail(values.email()).orElseGet(values::toPerson);
    }

    private static List<Period> toPeriods(List<PeriodValues> values) {
        if (values == null) {
            return null;
        }
        if (values.stream().anyMatch(v -> v == null)) {
            throw InvalidFieldException.of("periods", "must not contain empty entries");
        }
        return values.stream().map(PeriodValues::toPeriod).toList();
    }
}
