package io.shiplog.schedule;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

final class DrainScheduleTest {

    @Test
    void intervalFiresAfterFullPeriod() {
        DrainSchedule schedule = DrainSchedule.interval(Duration.ofMinutes(30));
        Instant last = Instant.parse("2024-03-01T10:00:00Z");

        Assertions.assertFalse(schedule.isDue(last, last.plusSeconds(1799), ZoneOffset.UTC));
        Assertions.assertTrue(schedule.isDue(last, last.plusSeconds(1800), ZoneOffset.UTC));
    }

    @Test
    void intervalBoundsAreEnforced() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> DrainSchedule.interval(Duration.ofMinutes(4)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> DrainSchedule.interval(Duration.ofHours(25)));
        Assertions.assertEquals(Duration.ofMinutes(5), DrainSchedule.interval(Duration.ofMinutes(5)).interval());
        Assertions.assertEquals(Duration.ofHours(24), DrainSchedule.interval(Duration.ofHours(24)).interval());
    }

    @Test
    void dailyFiresOncePerLocalDay() {
        DrainSchedule schedule = DrainSchedule.daily(LocalTime.of(3, 0));
        ZoneId zone = ZoneId.of("Europe/Berlin");
        Instant start = Instant.parse("2024-03-01T00:30:00Z");
        Instant at = Instant.parse("2024-03-01T02:00:00Z");

        Assertions.assertFalse(schedule.isDue(start, Instant.parse("2024-03-01T01:59:00Z"), zone));
        Assertions.assertTrue(schedule.isDue(start, at, zone));
        Assertions.assertFalse(schedule.isDue(at, Instant.parse("2024-03-01T20:00:00Z"), zone));
        Assertions.assertTrue(schedule.isDue(at, Instant.parse("2024-03-02T02:00:00Z"), zone));
    }

    @Test
    void dailyStartedAfterTodaysSlotWaitsForTomorrow() {
        DrainSchedule schedule = DrainSchedule.daily(LocalTime.of(3, 0));
        Instant start = Instant.parse("2024-03-01T09:00:00Z");

        Assertions.assertFalse(schedule.isDue(start, Instant.parse("2024-03-01T23:00:00Z"), ZoneOffset.UTC));
        Assertions.assertTrue(schedule.isDue(start, Instant.parse("2024-03-02T03:00:00Z"), ZoneOffset.UTC));
    }
}
