package com.newsrelay.collectors.source;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DateParsing {
    private static final ZoneId DEFAULT_ZONE = ZoneId.of("Europe/Moscow");
    private static final Pattern URL_DATE = Pattern.compile("/(20\\d{2})[/-](\\d{2})[/-](\\d{2})(?:/|$|[^\\d])");
    private static final DateTimeFormatter RFC_1123_LENIENT = DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm[:ss] Z", Locale.ENGLISH);
    private static final DateTimeFormatter SQL_LIKE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");
    private static final DateTimeFormatter RU_NUMERIC = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            value -> ZonedDateTime.parse(value, RFC_1123_LENIENT).toInstant(),
            value -> LocalDateTime.parse(value).atZone(DEFAULT_ZONE).toInstant(),
            value -> LocalDateTime.parse(value, SQL_LIKE).atZone(DEFAULT_ZONE).toInstant(),
            value -> LocalDateTime.parse(value, RU_NUMERIC).atZone(DEFAULT_ZONE).toInstant(),
            value -> LocalDate.parse(value).atStartOfDay(DEFAULT_ZONE).toInstant()
    );

    private DateParsing() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Function<String, Instant> parser : PARSERS) {
            Optional<Instant> parsed = safelyParse(parser, trimmed);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    public static Optional<Instant> fromUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = URL_DATE.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            LocalDate date = LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))
            );
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
