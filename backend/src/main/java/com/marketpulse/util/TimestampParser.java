package com.marketpulse.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort timestamp coercion. Never throws: anything that cannot be read
 * as a point in time comes back empty. Zoned values are converted to UTC.
 *
 * Numbers are epoch values; the unit follows the magnitude
 * (seconds below 1e11, then milliseconds, microseconds, nanoseconds).
 */
@Slf4j
public final class TimestampParser {

    // "2024-03-05 10:00[:00[.fffffffff]][+00:00]", as CSV exports write it
    private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .optionalStart()
        .appendLiteral(':')
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .toFormatter(Locale.ROOT)
        .withChronology(IsoChronology.INSTANCE)
        .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm[:ss]", Locale.ROOT),
        DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]", Locale.ROOT),
        DateTimeFormatter.ofPattern("d.M.yyyy H:mm[:ss]", Locale.ROOT)
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT),
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT),
        DateTimeFormatter.ofPattern("d.M.yyyy", Locale.ROOT),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)
    );

    private TimestampParser() {
    }

    public static Optional<LocalDateTime> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDateTime) {
            return Optional.of((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return Optional.of(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof Instant) {
            return Optional.of(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime) {
            return Optional.of(LocalDateTime.ofInstant(((ZonedDateTime) value).toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof Date) {
            return Optional.of(LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof Number) {
            return fromEpoch((Number) value);
        }
        if (value instanceof String) {
            return parseText(((String) value).trim());
        }
        return Optional.empty();
    }

    static Optional<LocalDateTime> fromEpoch(Number value) {
        double raw = value.doubleValue();
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            return Optional.empty();
        }
        double abs = Math.abs(raw);
        double perSecond = abs < 1e11 ? 1 : abs < 1e14 ? 1e3 : abs < 1e17 ? 1e6 : 1e9;
        double seconds = raw / perSecond;
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1e9);
        return Optional.of(LocalDateTime.ofInstant(Instant.ofEpochSecond(whole, nanos), ZoneOffset.UTC));
    }

    private static Optional<LocalDateTime> parseText(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Optional<TemporalAccessor> zoned = tryParse(DateTimeFormatter.ISO_OFFSET_DATE_TIME, text);
        if (zoned.isPresent()) {
            return Optional.of(LocalDateTime.ofInstant(Instant.from(zoned.get()), ZoneOffset.UTC));
        }
        Optional<TemporalAccessor> instant = tryParse(DateTimeFormatter.ISO_INSTANT, text);
        if (instant.isPresent()) {
            return Optional.of(LocalDateTime.ofInstant(Instant.from(instant.get()), ZoneOffset.UTC));
        }
        Optional<TemporalAccessor> spaced = tryParse(SPACED_DATE_TIME, text);
        if (spaced.isPresent()) {
            TemporalAccessor t = spaced.get();
            if (t.isSupported(ChronoField.OFFSET_SECONDS)) {
                return Optional.of(OffsetDateTime.from(t).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
            }
            return Optional.of(LocalDateTime.from(t));
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<TemporalAccessor> parsed = tryParse(format, text);
            if (parsed.isPresent()) {
                return Optional.of(LocalDateTime.from(parsed.get()));
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<TemporalAccessor> parsed = tryParse(format, text);
            if (parsed.isPresent()) {
                return Optional.of(LocalDate.from(parsed.get()).atStartOfDay());
            }
        }
        log.debug("Unparseable timestamp value: '{}'", text);
        return Optional.empty();
    }

    private static Optional<TemporalAccessor> tryParse(DateTimeFormatter format, String text) {
        try {
            return Optional.of(format.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
