package jsontime.datetime;

public final class NamedPatterns {
    public static final String ISO = "iso";
    public static final String ISO_NANOS = "iso_nanos";
    public static final String ISO_SECONDS = "iso_seconds";
    public static final String RFC3339 = "rfc3339";
    public static final String RFC3339_NANO = "rfc3339_nano";
    public static final String RFC1123 = "rfc1123";
    public static final String DATE_ONLY = "date_only";
    public static final String DATE_TIME = "date_time";
    public static final String MILLISECONDS = "milliseconds";
    public static final String SECONDS = "seconds";

    private NamedPatterns() {}
}
