package jsontime.datetime;

/**
 * A processor whose printed form is a decimal number, so it can be written as a JSON number.
 */
public interface NumericDateTimeProcessor extends DatetimeProcessor {
}
