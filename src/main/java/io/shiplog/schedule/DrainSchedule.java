package io.shiplog.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

public record DrainSchedule(Mode mode, Duration interval, LocalTime dailyTime) {
    public static final Duration MIN_INTERVAL = Duration.ofMinutes(5);
    public static final Duration MAX_INTERVAL = Duration.ofHours(24);

    public enum Mode {
        INTERVAL,
        DAILY
    }

    public DrainSchedule {
        Objects.requireNonNull(mode, "mode");
        if (mode == Mode.INTERVAL) {
            Objects.requireNonNull(interval, "interval");
            if (interval.compareTo(MIN_INTERVAL) < 0 || interval.compareTo(MAX_INTERVAL) > 0) {
                throw new IllegalArgumentException("interval must be between 5 minutes and 24 hours: " + interval);
            }
        } else {
            Objects.requireNonNull(dailyTime, "dailyTime");
        }
    }

    public static DrainSchedule interval(Duration interval) {
        return new DrainSchedule(Mode.INTERVAL, interval, null);
    }

    public static DrainSchedule daily(LocalTime time) {
        return new DrainSchedule(Mode.DAILY, null, time);
    }

    public boolean isDue(Instant lastFiredAt, Instant now, ZoneId zone) {
        if (mode == Mode.INTERVAL) {
            return lastFiredAt == null || !now.isBefore(lastFiredAt.plus(interval));
        }
        Instant todayAt = now.atZone(zone).toLocalDate().atTime(dailyTime).atZone(zone).toInstant();
        if (now.isBefore(todayAt)) {
            return false;
        }
        return lastFiredAt == null || lastFiredAt.isBefore(todayAt);
    }

    public String describe() {
        return mode == Mode.INTERVAL ? "every " + interval.toMinutes() + " min" : "daily at " + dailyTime;
    }
}
