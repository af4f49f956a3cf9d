package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Maps wall-clock time onto reward periods ({@code yyyy-MM}) and calendar days
 * in the configured zone.
 */
@Component
public class RewardCalendar {

    private static final DateTimeFormatter PERIOD_KEY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");

    private final Clock clock;
    private final ZoneId zone;

    public RewardCalendar(Clock clock, StreamEarnProperties streamEarnProperties) {
        this.clock = clock;
        this.zone = streamEarnProperties.getZone();
    }

    public Instant instant() {
        return clock.instant();
    }

    public OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), zone);
    }

    public OffsetDateTime at(Instant instant) {
        return OffsetDateTime.ofInstant(instant, zone);
    }

    public String currentPeriodKey() {
        return periodKeyOf(clock.instant());
    }

    public String periodKeyOf(Instant instant) {
        return YearMonth.from(instant.atZone(zone)).format(PERIOD_KEY_FORMAT);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    public LocalDate dateOf(Instant instant) {
        return LocalDate.ofInstant(instant, zone);
    }

    public OffsetDateTime startOf(LocalDate date) {
        return date.atStartOfDay(zone).toOffsetDateTime();
    }

    /**
     * Parses and validates a period key.
     *
     * @throws IllegalArgumentException when the key is not a {@code yyyy-MM} month
     */
    public YearMonth parsePeriodKey(String periodKey) {
        if (periodKey == null || periodKey.length() != 7) {
            throw new IllegalArgumentException("Invalid period key: " + periodKey);
        }
        try {
            return YearMonth.parse(periodKey, PERIOD_KEY_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid period key: " + periodKey);
        }
    }
}
