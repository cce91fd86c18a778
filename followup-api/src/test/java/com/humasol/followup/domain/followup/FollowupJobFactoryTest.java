package com.humasol.followup.domain.followup;

import static com.humasol.followup.test.fixtures.FollowupFixtures.FIXED_CLOCK;
import static com.humasol.followup.test.fixtures.FollowupFixtures.SOME_EMAIL;
import static com.humasol.followup.test.fixtures.FollowupFixtures.SOME_NAME;
import static com.humasol.followup.test.fixtures.FollowupFixtures.SOME_PROJECT_ID;
import static com.humasol.followup.test.fixtures.FollowupFixtures.SOME_TASK_FUNCTION;
import static com.humasol.followup.test.fixtures.FollowupFixtures.SOME_TASK_NAME;
import static com.humasol.followup.test.fixtures.FollowupFixtures.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.person.Person;
import com.humasol.followup.domain.person.PersonRepository;
import com.humasol.followup.domain.person.PersonValues;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FollowupJobFactoryTest {

    @Mock
    PersonRepository personRepository;

    FollowupJobFactory factory;

    @BeforeEach
    void setUp() {
        factory = new FollowupJobFactory(personRepository, FIXED_CLOCK);
    }

    private static NewFollowupJob.NewFollowupJobBuilder descriptionBuilder() {
        return NewFollowupJob.builder()
                .type(FollowupJobType.SUBSCRIPTION)
                .projectId(SOME_PROJECT_ID)
                .subscriber(PersonValues.builder().name(SOME_NAME).email(SOME_EMAIL).build())
                .periods(List.of(PeriodValues.builder()
                        .interval(1)
                        .unit(TimeUnit.MONTH)
                        .startDate(TODAY)
                        .build()));
    }

    @Test
    void shouldReuseKnownSubscriber() {
        // given
        var known = Person.restore(5L, "Jane Known", SOME_EMAIL, null);
        given(personRepository.findByEmail(SOME_EMAIL)).willReturn(Optional.of(known));

        // when
        var job = factory.create(descriptionBuilder().build());

        // then
        assertThat(job).isInstanceOf(Subscription.class);
        assertThat(job.getSubscriber()).isSameAs(known);
    }

    @Test
    void shouldCreateNewSubscriber() {
        given(personRepository.findByEmail(SOME_EMAIL)).willReturn(Optional.empty());

        var job = factory.create(descriptionBuilder().build());

        assertThat(job.getSubscriber().getId()).isNull();
        assertThat(job.getSubscriber().getName()).isEqualTo(SOME_NAME);
    }

    @Test
    void shouldCreateTask() {
        // given
        given(personRepository.findByEmail(SOME_EMAIL)).willReturn(Optional.empty());
        var description = descriptionBuilder()
                .type(FollowupJobType.TASK)
                .name(SOME_TASK_NAME)
                .function(SOME_TASK_FUNCTION)
                .build();

        // when
        var job = factory.create(description);

        // then
        assertThat(job).isInstanceOfSatisfying(Task.class, task -> {
            assertThat(task.getName()).isEqualTo(SOME_TASK_NAME);
            assertThat(task.getFunction()).isEqualTo(SOME_TASK_FUNCTION);
            assertThat(task.getPeriods()).singleElement().extracting(Period::getUnit).isEqualTo(TimeUnit.MONTH);
        });
    }

    @Test
    void shouldRejectTaskWithoutName() {
        given(personRepository.findByEmail(SOME_EMAIL)).willReturn(Optional.empty());

        assertThatThrownBy(() -> factory.create(descriptionBuilder().type(FollowupJobType.TASK).build()))
                .isInstanceOf(InvalidFieldException.class)
                .extracting("field")
                .isEqualTo("name");
    }

    @Test
    void shouldRejectMissingTypeOrSubscriber() {
        assertThatThrownBy(() -> factory.create(descriptionBuilder().type(null).build()))
                .isInstanceOf(InvalidFieldException.class)
                .extracting("field")
                .isEqualTo("type");
        assertThatThrownBy(() -> factory.create(descriptionBuilder().subscriber(null).build()))
                .isInstanceOf(InvalidFieldException.class)
                .extracting("field")
                .isEqualTo("subscriber");
    }
}
