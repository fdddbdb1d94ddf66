package org.example.insights.service;

import org.example.insights.config.AutoRecapProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Computes auto-recap fire times. Slots are fixed hours of the day in the configured zone.
 */
@Component
public class RecapScheduleCalculator {

    private final Clock clock;
    private final ZoneId zoneId;

    @Autowired
    public RecapScheduleCalculator(AutoRecapProperties properties) {
        this(Clock.systemUTC(), ZoneId.of(properties.getZoneId()));
    }

    RecapScheduleCalculator(Clock clock, ZoneId zoneId) {
        this.clock = clock;
        this.zoneId = zoneId;
    }

    public static List<Integer> slotHours(int ratesPerDay) {
        return switch (ratesPerDay) {
            case 3 -> List.of(0, 8, 16);
            case 2 -> List.of(0, 12);
            default -> List.of(0, 6, 12, 18);
        };
    }

    /**
     * First slot strictly after {@code now}.
     */
    public static ZonedDateTime nextSlot(int ratesPerDay, ZonedDateTime now) {
        ZonedDateTime startOfDay = now.toLocalDate().atStartOfDay(now.getZone());
        for (int day = 0; day <= 1; day++) {
            for (int hour : slotHours(ratesPerDay)) {
                ZonedDateTime candidate = startOfDay.plusDays(day).withHour(hour);
                if (candidate.isAfter(now)) {
                    return candidate;
                }
            }
        }
        return startOfDay.plusDays(2);
    }

    /**
     * Next fire time as a UTC timestamp, the form the capsule queue stores.
     */
    public LocalDateTime nextDueAtUtc(int ratesPerDay) {
        ZonedDateTime next = nextSlot(ratesPerDay, ZonedDateTime.now(clock).withZoneSameInstant(zoneId));
        return next.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    public LocalDateTime nowUtc() {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
    }
}
