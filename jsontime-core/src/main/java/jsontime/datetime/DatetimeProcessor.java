package jsontime.datetime;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Prints and parses timestamps for a single layout. Implementations are immutable, the
 * {@code with*} methods return a new processor when the setting changes.
 */
public interface DatetimeProcessor {

    Instant parseInstant(String datetime);

    /**
     * Parse a timestamp. If the text carries no zone information, the default zone of this
     * processor is used.
     * @param datetime the text to parse
     * @return the parsed timestamp
     * @throws java.time.format.DateTimeParseException if the text does not match the layout or
     *         describes an impossible date
     */
    ZonedDateTime parse(String datetime);

    String print(Instant instant);

    String print(ZonedDateTime zonedDateTime);

    DatetimeProcessor withLocale(Locale locale);

    DatetimeProcessor withDefaultZone(ZoneId zoneId);

    static DatetimeProcessor of(String pattern) {
        return PatternResolver.createNewFormatter(pattern);
    }

}
