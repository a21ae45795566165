package jsontime.datetime;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

import lombok.Getter;

/**
 * Moves a temporal value to and from a {@link ZonedDateTime}. Values without zone information are
 * interpreted in the zone given to {@link #toZoned(Object, ZoneId)}.
 * @param <T> the temporal type
 */
public final class TemporalConverter<T> {

    public static final TemporalConverter<ZonedDateTime> ZONED_DATE_TIME = new TemporalConverter<>(ZonedDateTime.class, ZonedDateTime::withZoneSameInstant, z -> z);
    public static final TemporalConverter<OffsetDateTime> OFFSET_DATE_TIME = new TemporalConverter<>(OffsetDateTime.class, OffsetDateTime::atZoneSameInstant, ZonedDateTime::toOffsetDateTime);
    public static final TemporalConverter<Instant> INSTANT = new TemporalConverter<>(Instant.class, Instant::atZone, ZonedDateTime::toInstant);
    public static final TemporalConverter<LocalDateTime> LOCAL_DATE_TIME = new TemporalConverter<>(LocalDateTime.class, LocalDateTime::atZone, ZonedDateTime::toLocalDateTime);
    public static final TemporalConverter<LocalDate> LOCAL_DATE = new TemporalConverter<>(LocalDate.class, LocalDate::atStartOfDay, ZonedDateTime::toLocalDate);
    // java.sql.Date refuses toInstant()
    public static final TemporalConverter<Date> DATE = new TemporalConverter<>(Date.class, (d, z) -> Instant.ofEpochMilli(d.getTime()).atZone(z), z -> Date.from(z.toInstant()));

    public static final List<TemporalConverter<?>> ALL = List.of(ZONED_DATE_TIME, OFFSET_DATE_TIME, INSTANT, LOCAL_DATE_TIME, LOCAL_DATE, DATE);

    @Getter
    private final Class<T> type;
    private final BiFunction<T, ZoneId, ZonedDateTime> toZoned;
    private final Function<ZonedDateTime, T> fromZoned;

    private TemporalConverter(Class<T> type, BiFunction<T, ZoneId, ZonedDateTime> toZoned, Function<ZonedDateTime, T> fromZoned) {
        this.type = type;
        this.toZoned = toZoned;
        this.fromZoned = fromZoned;
    }

    public ZonedDateTime toZoned(T value, ZoneId zone) {
        return toZoned.apply(value, zone);
    }

    public T fromZoned(ZonedDateTime value) {
        return fromZoned.apply(value);
    }

    /**
     * Find a converter using the simple name of the handled class, like {@code LocalDate}.
     */
    public static Optional<TemporalConverter<?>> forName(String simpleName) {
        return ALL.stream().filter(c -> c.type.getSimpleName().equals(simpleName)).findFirst();
    }

    @Override
    public String toString() {
        return "TemporalConverter[" + type.getName() + "]";
    }

}
