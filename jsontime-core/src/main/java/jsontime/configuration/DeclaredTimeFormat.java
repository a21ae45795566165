package jsontime.configuration;

import lombok.Data;

/**
 * What a property declares about its time format. Each facet is optional, a null value means
 * that the facet is inherited from a wider scope.
 */
@Data
public class DeclaredTimeFormat {

    public static final DeclaredTimeFormat NONE = new DeclaredTimeFormat(null, null, null);

    /**
     * A layout alias, a named pattern or a pattern.
     */
    private final String format;
    /**
     * A zone alias or a zone ID.
     */
    private final String location;
    /**
     * An IETF language tag.
     */
    private final String locale;

    public DeclaredTimeFormat(String format, String location, String locale) {
        this.format = emptyToNull(format);
        this.location = emptyToNull(location);
        this.locale = emptyToNull(locale);
    }

    public boolean isEmpty() {
        return format == null && location == null && locale == null;
    }

    /**
     * Fill the missing facets from a fallback.
     */
    public DeclaredTimeFormat orElse(DeclaredTimeFormat fallback) {
        if (fallback.isEmpty()) {
            return this;
        } else if (isEmpty()) {
            return fallback;
        } else {
            return new DeclaredTimeFormat(format != null ? format : fallback.format,
                                          location != null ? location : fallback.location,
                                          locale != null ? locale : fallback.locale);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

}
