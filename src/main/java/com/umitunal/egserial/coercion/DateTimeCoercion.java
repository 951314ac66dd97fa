package com.umitunal.egserial.coercion;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 timestamps. Output always carries an offset; input may omit the
 * offset (read as UTC) or the whole time part (midnight UTC), and may use a
 * space instead of {@code T} between date and time.
 */
public class DateTimeCoercion implements Coercion<OffsetDateTime> {

    private static final DateTimeFormatter LENIENT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    @Override
    public Class<OffsetDateTime> type() {
        return OffsetDateTime.class;
    }

    @Override
    public String format(OffsetDateTime value) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
    }

    @Override
    public OffsetDateTime parse(String text) {
        String normalized = text.trim();
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }

        try {
            TemporalAccessor parsed = LENIENT.parseBest(normalized,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Not an ISO-8601 date-time: " + text, e);
        }
    }
}
