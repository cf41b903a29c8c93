package com.example.cardpipeline.silver;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Converts raw Bronze text into typed values. Unparseable input yields an empty result, never an exception.
 */
final class FieldParsers {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACE_SEPARATED);

    private FieldParsers() {
    }

    static Optional<BigDecimal> parseAmount(String text) {
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts ISO-8601 values with an offset ({@code 2024-01-15T10:30:00Z}) or without one
     * ({@code 2024-01-15T10:30:00}, {@code 2024-01-15 10:30:00}), and bare dates ({@code 2024-01-15}) which stand
     * for the start of that day. Values without an offset are read in {@code zone}.
     */
    static Optional<Instant> parseTimestamp(String text, ZoneId zone) {
        Optional<Instant> withOffset = attempt(() ->
                OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        if (withOffset.isPresent()) {
            return withOffset;
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            Optional<Instant> local = attempt(() -> LocalDateTime.parse(text, format).atZone(zone).toInstant());
            if (local.isPresent()) {
                return local;
            }
        }
        return attempt(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone).toInstant());
    }

    private static Optional<Instant> attempt(Supplier<Instant> parse) {
        try {
            return Optional.of(parse.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * An absent flag is read as "not fraud"; only a present value that is not a recognised boolean is invalid.
     */
    static Optional<Boolean> parseFraudFlag(String text) {
        if (text == null) {
            return Optional.of(Boolean.FALSE);
        }
        switch (text.toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
            case "yes":
                return Optional.of(Boolean.TRUE);
            case "0":
            case "false":
            case "no":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }
}
