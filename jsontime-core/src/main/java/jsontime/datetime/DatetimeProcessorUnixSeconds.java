package jsontime.datetime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

class DatetimeProcessorUnixSeconds implements NumericDateTimeProcessor {

    private static final BigDecimal ONE_MILLIARD = BigDecimal.valueOf(1_000_000_000L);

    private final ZoneId zoneId;

    DatetimeProcessorUnixSeconds() {
        this(ZoneId.systemDefault());
    }

    private DatetimeProcessorUnixSeconds(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    @Override
    public Instant parseInstant(String datetime) {
        try {
            if (datetime.indexOf('.') == -1 && datetime.indexOf('e') == -1 && datetime.indexOf('E') == -1) {
                return Instant.ofEpochSecond(Long.parseLong(datetime));
            } else {
                BigDecimal floatValue = new BigDecimal(datetime);
                BigDecimal seconds = new BigDecimal(floatValue.toBigInteger());
                int nano = floatValue.subtract(seconds).multiply(ONE_MILLIARD).intValue();
                return Instant.ofEpochSecond(seconds.longValueExact(), nano);
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new DateTimeParseException(String.format("Failed to parse date \"%s\": Not a number", datetime), datetime, 0);
        }
    }

    @Override
    public ZonedDateTime parse(String datetime) {
        return parseInstant(datetime).atZone(zoneId);
    }

    @Override
    public String print(Instant timestamp) {
        BigDecimal instantNumber = BigDecimal.valueOf(timestamp.getNano())
                                             .divide(ONE_MILLIARD, MathContext.UNLIMITED)
                                             .add(BigDecimal.valueOf(timestamp.getEpochSecond()));
        return instantNumber.stripTrailingZeros().toPlainString();
    }

    @Override
    public String print(ZonedDateTime timestamp) {
        return print(timestamp.toInstant());
    }

    @Override
    public DatetimeProcessor withLocale(Locale locale) {
        // JSON numbers are locale independent
        return this;
    }

    @Override
    public DatetimeProcessor withDefaultZone(ZoneId zoneId) {
        return this.zoneId.equals(zoneId) ? this : new DatetimeProcessorUnixSeconds(zoneId);
    }

}
