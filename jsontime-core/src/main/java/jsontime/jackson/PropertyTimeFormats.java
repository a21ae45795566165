package jsontime.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.BeanProperty;

import jsontime.TimeFormat;
import jsontime.TimeLocation;
import jsontime.configuration.DeclaredTimeFormat;

/**
 * Reads the time format declared by a property, merging the property annotations, its
 * {@link JsonFormat} and the annotations of the declaring class, in that order.
 */
class PropertyTimeFormats {

    private PropertyTimeFormats() {}

    static DeclaredTimeFormat declared(BeanProperty property, JsonFormat.Value format) {
        if (property == null) {
            return DeclaredTimeFormat.NONE;
        }
        DeclaredTimeFormat fieldLevel = fromAnnotations(property.getAnnotation(TimeFormat.class), property.getAnnotation(TimeLocation.class));
        DeclaredTimeFormat classLevel = fromAnnotations(property.getContextAnnotation(TimeFormat.class), property.getContextAnnotation(TimeLocation.class));
        return fieldLevel.orElse(fromJsonFormat(format)).orElse(classLevel);
    }

    private static DeclaredTimeFormat fromAnnotations(TimeFormat timeFormat, TimeLocation timeLocation) {
        if (timeFormat == null && timeLocation == null) {
            return DeclaredTimeFormat.NONE;
        } else {
            return new DeclaredTimeFormat(timeFormat != null ? timeFormat.value() : null,
                                          timeLocation != null ? timeLocation.value() : null,
                                          timeFormat != null ? timeFormat.locale() : null);
        }
    }

    private static DeclaredTimeFormat fromJsonFormat(JsonFormat.Value format) {
        if (format == null) {
            return DeclaredTimeFormat.NONE;
        } else {
            return new DeclaredTimeFormat(format.hasPattern() ? format.getPattern() : null,
                                          format.hasTimeZone() ? format.timeZoneAsString() : null,
                                          format.hasLocale() ? format.getLocale().toLanguageTag() : null);
        }
    }

}
