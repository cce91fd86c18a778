package com.humasol.followup.domain.followup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import java.time.LocalDate;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PeriodTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 6, 30);

    @Nested
    class Construction {

        @Test
        void shouldCreateOpenEndedPeriod() {
            // when
            var period = new Period(2, TimeUnit.MONTH, START);

            // then
            assertThat(period.getInterval()).isEqualTo(2);
            assertThat(period.getUnit()).isEqualTo(TimeUnit.MONTH);
            assertThat(period.getStart()).isEqualTo(START);
            assertThat(period.getEnd()).isNull();
        }

        @Test
        void shouldRejectNonPositiveInterval() {
            assertThatThrownBy(() -> new Period(0, TimeUnit.WEEK, START, END))
                    .isInstanceOf(InvalidFieldException.class)
                    .extracting("field")
                    .isEqualTo("interval");
        }

        @Test
        void shouldRejectMissingUnit() {
            assertThatThrownBy(() -> new Period(1, null, START, END))
                    .isInstanceOf(InvalidFieldException.class)
                    .extracting("field")
                    .isEqualTo("unit");
        }

        @Test
        void shouldRejectMissingStart() {
            assertThatThrownBy(() -> new Period(1, TimeUnit.WEEK, null, END))
                    .isInstanceOf(InvalidFieldException.class)
                    .extracting("field")
                    .isEqualTo("start");
        }

        @Test
        void shouldRejectEndOnStartDay() {
            assertThatThrownBy(() -> new Period(1, TimeUnit.WEEK, START, START))
                    .isInstanceOf(InvalidFieldException.class)
                    .hasMessageContaining("end");
        }

        @Test
        void shouldRejectEndBeforeStart() {
            assertThatThrownBy(() -> new Period(1, TimeUnit.WEEK, START, START.minusDays(1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Boundaries {

        private final Period period = new Period(1, TimeUnit.WEEK, START, END);

        @Test
        void shouldBeApplicableOnBothBoundaryDays() {
            assertThat(period.isApplicable(START)).isTrue();
            assertThat(period.isApplicable(END)).isTrue();
        }

        @Test
        void shouldNotBeApplicableOutsideWindow() {
            assertThat(period.isApplicable(START.minusDays(1))).isFalse();
            assertThat(period.isApplicable(END.plusDays(1))).isFalse();
            assertThat(period.isApplicable(null)).isFalse();
        }

        @Test
        void shouldOnlyHavePastTheDayAfterEnd() {
            assertThat(period.hasPast(END)).isFalse();
            assertThat(period.hasPast(END.plusDays(1))).isTrue();
        }

        @Test
        void shouldNeverExpireWithoutEnd() {
            var openEnded = new Period(1, TimeUnit.YEAR, START);

            assertThat(openEnded.hasPast(START.plusYears(100))).isFalse();
            assertThat(openEnded.isApplicable(START.plusYears(100))).isTrue();
        }
    }

    @Nested
    class FirstCheckDay {

        @Test
        void shouldStartWeeklyCycleOnMonday() {
            var weekly = new Period(1, TimeUnit.WEEK, START);

            assertThat(weekly.isFirstCheckDay(LocalDate.of(2024, 3, 4))).isTrue();
            assertThat(weekly.isFirstCheckDay(LocalDate.of(2024, 3, 5))).isFalse();
        }

        @Test
        void shouldStartMonthlyCycleOnFirstOfMonth() {
            var monthly = new Period(1, TimeUnit.MONTH, START);

            assertThat(monthly.isFirstCheckDay(LocalDate.of(2024, 3, 1))).isTrue();
            assertThat(monthly.isFirstCheckDay(LocalDate.of(2024, 3, 2))).isFalse();
        }

        @Test
        void shouldNeverStartYearlyCycle() {
            var yearly = new Period(1, TimeUnit.YEAR, START);

            assertThat(yearly.isFirstCheckDay(LocalDate.of(2025, 1, 1))).isFalse();
        }
    }

    @Nested
    class ShouldUpdate {

        @Test
        void shouldFireOnMondayWhenNeverNotified() {
            var weekly = new Period(1, TimeUnit.WEEK, START);

            assertThat(weekly.shouldUpdate(null, LocalDate.of(2024, 3, 4))).isTrue();
            assertThat(weekly.shouldUpdate(null, LocalDate.of(2024, 3, 6))).isFalse();
        }

        @Test
        void shouldTreatNotificationBeforeStartAsNeverNotified() {
            var monthly = new Period(1, TimeUnit.MONTH, START);
            var lastNotification = START.minusDays(3);

            assertThat(monthly.shouldUpdate(lastNotification, LocalDate.of(2024, 2, 1))).isTrue();
            assertThat(monthly.shouldUpdate(lastNotification, LocalDate.of(2024, 2, 2))).isFalse();
        }

        @Test
        void shouldFireWeeklyAfterSevenDays() {
            // given
            var weekly = new Period(1, TimeUnit.WEEK, START);
            var lastNotification = LocalDate.of(2024, 2, 26);

            // then
            assertThat(weekly.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 3))).isFalse();
            assertThat(weekly.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 4))).isTrue();
        }

        @Test
        void shouldCountWholeWeeksAgainstInterval() {
            var biWeekly = new Period(2, TimeUnit.WEEK, START);
            var lastNotification = LocalDate.of(2024, 2, 26);

            assertThat(biWeekly.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 10))).isFalse();
            assertThat(biWeekly.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 11))).isTrue();
        }

        @Test
        void shouldFireMonthlyOnceIntervalMonthsElapsed() {
            // given
            var everyTwoMonths = new Period(2, TimeUnit.MONTH, START);
            var lastNotification = LocalDate.of(2024, 1, 15);

            // then
            assertThat(everyTwoMonths.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 14))).isFalse();
            assertThat(everyTwoMonths.shouldUpdate(lastNotification, LocalDate.of(2024, 3, 15))).isTrue();
        }

        @Test
        void shouldCountMonthsAcrossYearBoundary() {
            var quarterly = new Period(3, TimeUnit.MONTH, LocalDate.of(2023, 1, 1));

            assertThat(quarterly.shouldUpdate(LocalDate.of(2023, 12, 10), LocalDate.of(2024, 3, 10))).isTrue();
            assertThat(quarterly.shouldUpdate(LocalDate.of(2023, 12, 10), LocalDate.of(2024, 3, 9))).isFalse();
        }

        @Test
        void shouldFireYearlyOnceIntervalYearsElapsed() {
            var everyTwoYears = new Period(2, TimeUnit.YEAR, LocalDate.of(2022, 1, 1));
            var lastNotification = LocalDate.of(2022, 6, 1);

            assertThat(everyTwoYears.shouldUpdate(lastNotification, LocalDate.of(2024, 5, 31))).isFalse();
            assertThat(everyTwoYears.shouldUpdate(lastNotification, LocalDate.of(2024, 6, 1))).isTrue();
        }

        @Test
        void shouldNotFireYearlyWhenNeverNotified() {
            var yearly = new Period(1, TimeUnit.YEAR, START);

            assertThat(yearly.shouldUpdate(null, LocalDate.of(2025, 1, 1))).isFalse();
        }

        @Test
        void shouldNotFireWhenLastNotificationFellOutsideWindow() {
            var period = new Period(1, TimeUnit.WEEK, START, LocalDate.of(2024, 2, 1));

            assertThat(period.shouldUpdate(LocalDate.of(2024, 2, 10), LocalDate.of(2024, 3, 4))).isFalse();
        }
    }

    @Nested
    class Update {

        @Test
        void shouldOverwritePresentFieldsOnly() {
            // given
            var period = new Period(1, TimeUnit.WEEK, START, END);
            var changes = PeriodValues.builder().interval(3).unit(TimeUnit.MONTH).build();

            // when
            period.update(changes);

            // then
            assertThat(period.getInterval()).isEqualTo(3);
            assertThat(period.getUnit()).isEqualTo(TimeUnit.MONTH);
            assertThat(period.getStart()).isEqualTo(START);
            assertThat(period.getEnd()).isEqualTo(END);
        }

        @Test
        void shouldLeavePeriodUnchangedWhenIntervalRejected() {
            // given
            var period = new Period(1, TimeUnit.WEEK, START, END);
            var changes = PeriodValues.builder().interval(-1).unit(TimeUnit.YEAR).endDate(END.plusDays(1)).build();

            // when / then
            assertThatThrownBy(() -> period.update(changes)).isInstanceOf(InvalidFieldException.class);
            assertThat(period.getInterval()).isEqualTo(1);
            assertThat(period.getUnit()).isEqualTo(TimeUnit.WEEK);
            assertThat(period.getEnd()).isEqualTo(END);
        }

        @Test
        void shouldNotCompareUpdatedEndWithStart() {
            var period = new Period(1, TimeUnit.WEEK, START, END);

            period.update(PeriodValues.builder().endDate(START.minusDays(1)).build());

            assertThat(period.getEnd()).isEqualTo(START.minusDays(1));
        }

        @Test
        void shouldRestoreSnapshot() {
            var period = new Period(1, TimeUnit.WEEK, START, END);
            var restore = period.snapshot();

            period.update(PeriodValues.builder().interval(4).startDate(START.plusDays(2)).build());
            restore.run();

            assertThat(period.getInterval()).isEqualTo(1);
            assertThat(period.getStart()).isEqualTo(START);
        }
    }
}
