package io.shiplog.schedule;

import java.time.LocalTime;
import java.util.Objects;

// [start, end); an end before the start crosses midnight
public record OperationalHours(boolean enabled, LocalTime start, LocalTime end) {
    public OperationalHours {
        if (enabled) {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            if (start.equals(end)) {
                throw new IllegalArgumentException("operational hours start and end must differ: " + start);
            }
        }
    }

    public static OperationalHours always() {
        return new OperationalHours(false, null, null);
    }

    public boolean permits(LocalTime time) {
        if (!enabled) {
            return true;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
