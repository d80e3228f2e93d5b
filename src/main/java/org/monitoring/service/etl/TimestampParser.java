package org.monitoring.service.etl;

import org.monitoring.configuration.MonitoringProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses raw timestamp cells against the configured formats. Values without an offset are
 * read in the configured zone; date-only values resolve to the start of that day.
 */
@Component
public class TimestampParser {

    private static final long MILLIS_THRESHOLD = 100_000_000_000L; // ~1973 in ms
    private static final Pattern EPOCH = Pattern.compile("^-?\\d{10,}$");

    private static final Map<String, DateTimeFormatter> NAMED_FORMATS = Map.of(
            "ISO_DATE_TIME", DateTimeFormatter.ISO_DATE_TIME,
            "ISO_LOCAL_DATE_TIME", DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            "ISO_OFFSET_DATE_TIME", DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            "ISO_INSTANT", DateTimeFormatter.ISO_INSTANT,
            "ISO_DATE", DateTimeFormatter.ISO_DATE,
            "ISO_LOCAL_DATE", DateTimeFormatter.ISO_LOCAL_DATE
    );

    private final List<DateTimeFormatter> formatters;
    private final ZoneId zone;
    private final boolean acceptEpoch;

    public TimestampParser(MonitoringProperties properties) {
        MonitoringProperties.Ingestion ingestion = properties.getIngestion();
        this.zone = ZoneId.of(ingestion.getZone());
        this.acceptEpoch = ingestion.isAcceptEpoch();
        this.formatters = new ArrayList<>();
        for (String format : ingestion.getTimestampFormats()) {
            if (!StringUtils.hasText(format)) {
                continue;
            }
            DateTimeFormatter named = NAMED_FORMATS.get(format.trim().toUpperCase(Locale.ROOT));
            formatters.add(named != null ? named
                    : DateTimeFormatter.ofPattern(format.trim(), Locale.ROOT).withResolverStyle(ResolverStyle.SMART));
        }
    }

    public Optional<Instant> parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String value = raw.trim();

        if (EPOCH.matcher(value).matches()) {
            if (!acceptEpoch) {
                return Optional.empty();
            }
            try {
                long epoch = Long.parseLong(value);
                return Optional.of(Math.abs(epoch) >= MILLIS_THRESHOLD
                        ? Instant.ofEpochMilli(epoch)
                        : Instant.ofEpochSecond(epoch));
            } catch (NumberFormatException | DateTimeException e) {
                return Optional.empty();
            }
        }

        for (DateTimeFormatter formatter : formatters) {
            Optional<Instant> parsed = tryParse(formatter, value);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    public boolean isParseable(String raw) {
        return parse(raw).isPresent();
    }

    private Optional<Instant> tryParse(DateTimeFormatter formatter, String value) {
        try {
            if (formatter == DateTimeFormatter.ISO_INSTANT) {
                return Optional.of(Instant.from(formatter.parse(value)));
            }
            TemporalAccessor parsed = formatter.parseBest(value, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toInstant());
            }
            if (parsed instanceof LocalDateTime local) {
                return Optional.of(local.atZone(zone).toInstant());
            }
            if (parsed instanceof LocalDate date) {
                return Optional.of(date.atStartOfDay(zone).toInstant());
            }
            return Optional.empty();
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
