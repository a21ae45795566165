package jsontime.configuration;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

import jsontime.datetime.DatetimeProcessor;
import jsontime.datetime.NumericDateTimeProcessor;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * The effective layout, zone and locale of a property. Writing and reading a property use the
 * same instance.
 */
@Getter
public class ResolvedTimeFormat {

    private final String layout;
    private final ZoneId zone;
    private final Locale locale;
    @Getter(AccessLevel.NONE)
    private final DatetimeProcessor processor;

    ResolvedTimeFormat(String layout, ZoneId zone, Locale locale, DatetimeProcessor processor) {
        this.layout = layout;
        this.zone = zone;
        this.locale = locale;
        this.processor = processor;
    }

    /**
     * @return true if the layout prints numbers, like epoch seconds
     */
    public boolean isNumeric() {
        return processor instanceof NumericDateTimeProcessor;
    }

    public String format(ZonedDateTime value) {
        return processor.print(value.withZoneSameInstant(zone));
    }

    /**
     * Parse a text and move it in the resolved zone.
     * @throws java.time.format.DateTimeParseException if the text is not a valid timestamp for the layout
     */
    public ZonedDateTime parse(String text) {
        return processor.parse(text).withZoneSameInstant(zone);
    }

    @Override
    public String toString() {
        return String.format("\"%s\"/%s/%s", layout, zone, locale.toLanguageTag());
    }

}
