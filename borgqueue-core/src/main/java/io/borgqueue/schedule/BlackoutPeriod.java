package io.borgqueue.schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Time range (inclusive on both ends) during which no scheduled run may happen.
 */
public record BlackoutPeriod(Instant start, Instant end) {

    public BlackoutPeriod {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
