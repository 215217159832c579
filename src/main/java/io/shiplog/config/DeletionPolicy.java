package io.shiplog.config;

import java.time.LocalTime;
import java.util.Objects;

public record DeletionPolicy(AfterUpload afterUpload, AgeBased ageBased, Emergency emergency) {
    public DeletionPolicy {
        Objects.requireNonNull(afterUpload, "afterUpload");
        Objects.requireNonNull(ageBased, "ageBased");
        Objects.requireNonNull(emergency, "emergency");
    }

    public static DeletionPolicy defaults() {
        return new DeletionPolicy(
                new AfterUpload(true, 14),
                new AgeBased(true, 7, LocalTime.of(2, 0)),
                new Emergency(false)
        );
    }

    public record AfterUpload(boolean enabled, int keepDays) {
        public AfterUpload {
            if (keepDays < 0) {
                throw new ConfigValidationException("deletion.after_upload.keep_days", "must be >= 0");
            }
        }
    }

    public record AgeBased(boolean enabled, int maxAgeDays, LocalTime scheduleTime) {
        public AgeBased {
            if (maxAgeDays < 1) {
                throw new ConfigValidationException("deletion.age_based.max_age_days", "must be >= 1");
            }
            Objects.requireNonNull(scheduleTime, "scheduleTime");
        }
    }

    public record Emergency(boolean enabled) {
    }
}
