package jsontime.datetime;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static jsontime.datetime.DatetimeProcessorUtil.appendNumberWithFixedPositions;

/**
 * Creates {@link DatetimeProcessor} for a layout. Each DatetimeProcessor object is immutable,
 * so consider caching them.
 */
class PatternResolver {
    static final Set<String> VALID_ZONE_FORMATTERS = Set.of(
            "X", "XX", "XXX", "XXXX", "XXXXX",  // zone-offset 'Z' for zero: Z; -08; -0830; -08:30; -083015; -08:30:15
            "x", "xx", "xxx", "xxxx", "xxxxx",  // zone-offset: +0000; -08; -0830; -08:30; -083015; -08:30:15
            "Z", "ZZ", "ZZZ", "ZZZZZ"           // zone-offset: +0000; -0800; -08:00
    );
    private static final String VALID_ZONE_PATTERNS = "(" + String.join("|", VALID_ZONE_FORMATTERS) + ")";

    private static final Pattern IO8601_PATTERN = Pattern.compile(String.format("yyyy-MM-dd('.'|.)HH:mm:ss(([.,])S{1,9})?(%s)?", VALID_ZONE_PATTERNS));

    private PatternResolver() {}

    static DatetimeProcessor createNewFormatter(String pattern) {
        DatetimeProcessor result;
        if (NamedPatterns.SECONDS.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorUnixSeconds();
        } else if (NamedPatterns.MILLISECONDS.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorUnixMillis();
        } else if (NamedPatterns.ISO.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorIso8601(3, resolveZoneOffset("XXXXX"), 'T', '.');
        } else if (NamedPatterns.ISO_SECONDS.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorIso8601(0, resolveZoneOffset("XXXXX"), 'T', '.');
        } else if (NamedPatterns.ISO_NANOS.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorIso8601(9, resolveZoneOffset("XXXXX"), 'T', '.');
        } else if (NamedPatterns.RFC3339.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorIso8601(0, resolveZoneOffset("XXX"), 'T', '.');
        } else if (NamedPatterns.RFC3339_NANO.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorIso8601(9, resolveZoneOffset("XXX"), 'T', '.');
        } else if (NamedPatterns.RFC1123.equalsIgnoreCase(pattern)) {
            result = new DatetimeProcessorCustom(DateTimeFormatter.RFC_1123_DATE_TIME.withResolverStyle(ResolverStyle.STRICT));
        } else if (NamedPatterns.DATE_ONLY.equalsIgnoreCase(pattern)) {
            result = createFromDynamicPattern("uuuu-MM-dd");
        } else if (NamedPatterns.DATE_TIME.equalsIgnoreCase(pattern)) {
            result = createFromDynamicPattern("yyyy-MM-dd HH:mm:ss");
        } else {
            result = createFromDynamicPattern(pattern);
        }
        return result;
    }

    private static DatetimeProcessor createFromDynamicPattern(String pattern) {
        Matcher matcherIso8601 = IO8601_PATTERN.matcher(pattern);
        if (matcherIso8601.matches()) {
            int fractions = stringLength(matcherIso8601.group(2)) - 1;
            char delimiter;
            if (matcherIso8601.group(1).length() == 3) {
                delimiter = matcherIso8601.group(1).charAt(1);
            } else {
                delimiter = matcherIso8601.group(1).charAt(0);
            }
            char decimalMark;
            if (fractions > 0) {
                decimalMark = matcherIso8601.group(3).charAt(0);
            } else {
                fractions = 0;
                decimalMark = '.';
            }
            return new DatetimeProcessorIso8601(fractions, resolveZoneOffset(matcherIso8601.group(4)), delimiter, decimalMark);
        }
        DateTimeFormatter dateTimeFormatter = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
        return new DatetimeProcessorCustom(dateTimeFormatter);
    }

    private static int stringLength(String value) {
        return value == null ? 0 : value.length();
    }

    static AppendOffset resolveZoneOffset(String pattern) {
        if (pattern == null) {
            return null;
        } else {
            switch (pattern) {
            case "X":
                return (sb, zdt) -> appendFormattedSecondOffset("Z", true, false, false, zdt, sb);
            case "XX":
                return (sb, zdt) -> appendFormattedSecondOffset("Z", false, false, false, zdt, sb);
            case "XXX":
                return (sb, zdt) -> appendFormattedSecondOffset("Z", false, false, true, zdt, sb);
            case "XXXX":
                return (sb, zdt) -> appendFormattedSecondOffset("Z", false, true, false, zdt, sb);
            case "XXXXX":
            case "ZZZZZ":
                return (sb, zdt) -> appendFormattedSecondOffset("Z", false, true, true, zdt, sb);
            case "x":
                return (sb, zdt) -> appendFormattedSecondOffset(null, true, false, false, zdt, sb);
            case "xx":
            case "Z":
            case "ZZ":
            case "ZZZ":
                return (sb, zdt) -> appendFormattedSecondOffset(null, false, false, false, zdt, sb);
            case "xxx":
                return (sb, zdt) -> appendFormattedSecondOffset(null, false, false, true, zdt, sb);
            case "xxxx":
                return (sb, zdt) -> appendFormattedSecondOffset(null, false, true, false, zdt, sb);
            case "xxxxx":
                return (sb, zdt) -> appendFormattedSecondOffset(null, false, true, true, zdt, sb);
            default:
                throw new IllegalArgumentException("Unhandled zone offset pattern: " + pattern);
            }
        }
    }

    /**
     * Append a zone offset.
     * @param zuluTime text used for a zero offset, null to print it as a number
     * @param optionalMinutes minutes are printed only when not zero
     * @param withSeconds seconds are printed when not zero
     * @param colon use ':' between hours, minutes and seconds
     */
    static StringBuilder appendFormattedSecondOffset(String zuluTime, boolean optionalMinutes, boolean withSeconds, boolean colon, ZonedDateTime zdt, StringBuilder sb) {
        int offsetSeconds = zdt.query(TemporalQueries.offset()).getTotalSeconds();
        if (offsetSeconds == 0 && zuluTime != null) {
            return sb.append(zuluTime);
        } else {
            sb.append(offsetSeconds < 0 ? '-' : '+');
            int absSeconds = Math.abs(offsetSeconds);
            int minutes = (absSeconds / 60) % 60;
            int seconds = absSeconds % 60;
            appendNumberWithFixedPositions(sb, absSeconds / 3600, 2);
            if (! optionalMinutes || minutes != 0) {
                if (colon) {
                    sb.append(':');
                }
                appendNumberWithFixedPositions(sb, minutes, 2);
            }
            if (withSeconds && seconds != 0) {
                if (colon) {
                    sb.append(':');
                }
                appendNumberWithFixedPositions(sb, seconds, 2);
            }
            return sb;
        }
    }

}
