package com.humasol.followup.domain.followup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import org.junit.jupiter.api.Test;

class TimeUnitTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertThat(TimeUnit.fromString("week")).isEqualTo(TimeUnit.WEEK);
        assertThat(TimeUnit.fromString("MONTH")).isEqualTo(TimeUnit.MONTH);
        assertThat(TimeUnit.fromString(" Year ")).isEqualTo(TimeUnit.YEAR);
    }

    @Test
    void shouldRenderLowerCaseLabel() {
        assertThat(TimeUnit.MONTH).hasToString("month");
    }

    @Test
    void shouldRejectUnknownUnit() {
        assertThatThrownBy(() -> TimeUnit.fromString("day"))
                .isInstanceOf(InvalidFieldException.class)
                .hasMessageContaining("day");
        assertThatThrownBy(() -> TimeUnit.fromString(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
