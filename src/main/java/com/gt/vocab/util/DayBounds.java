package com.gt.vocab.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

// Half-open [start, end) range covering one local calendar day
public record DayBounds(Instant start, Instant end) {

    public static DayBounds containing(Instant instant, ZoneId zone) {
        return forDate(instant.atZone(zone).toLocalDate(), zone);
    }

    public static DayBounds forDate(LocalDate date, ZoneId zone) {
        return new DayBounds(date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant());
    }

    public DayBounds previousDay(ZoneId zone) {
        return forDate(start.atZone(zone).toLocalDate().minusDays(1), zone);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && instant.isBefore(end);
    }
}
