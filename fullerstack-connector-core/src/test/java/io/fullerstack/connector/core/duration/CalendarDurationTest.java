package io.fullerstack.connector.core.duration;

import io.fullerstack.connector.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CalendarDuration}.
 */
class CalendarDurationTest {

    @Test
    void shouldParseDaysHoursMinutesAndSeconds() {
        assertThat(CalendarDuration.parse("P7D")).isEqualTo(Duration.ofDays(7));
        assertThat(CalendarDuration.parse("PT3H")).isEqualTo(Duration.ofHours(3));
        assertThat(CalendarDuration.parse("P1DT3H")).isEqualTo(Duration.ofHours(27));
        assertThat(CalendarDuration.parse("PT1H30M")).isEqualTo(Duration.ofMinutes(90));
        assertThat(CalendarDuration.parse("PT1.250S")).isEqualTo(Duration.ofMillis(1250));
    }

    @Test
    void shouldRejectUnsupportedGrammar() {
        assertThatThrownBy(() -> CalendarDuration.parse("P1W"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Unrecognized ISO duration P1W");
        assertThatThrownBy(() -> CalendarDuration.parse("7 days")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CalendarDuration.parse("PT1.2345S")).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRequirePositiveWholeSeconds() {
        assertThat(CalendarDuration.parsePositiveSeconds("P1D")).isEqualTo(86_400L);

        assertThatThrownBy(() -> CalendarDuration.parsePositiveSeconds("P0D"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Illegal shift interval 'P0D' specified, must be > 0 seconds");
        assertThatThrownBy(() -> CalendarDuration.parsePositiveSeconds("PT0.5S"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldHumanizeElapsedSeconds() {
        assertThat(CalendarDuration.humanize(7 * 86_400)).isEqualTo("7d");
        assertThat(CalendarDuration.humanize(86_400 + 3 * 3600)).isEqualTo("1d 3h");
        assertThat(CalendarDuration.humanize(3725)).isEqualTo("1h 2m 5s");
        assertThat(CalendarDuration.humanize(0)).isEmpty();
    }
}
