package jsontime;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the layout used to write and read a temporal property. On a class, it sets the layout
 * of all the temporal properties of that class that don't declare their own.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.TYPE})
public @interface TimeFormat {
    /**
     * A registered layout alias, a named pattern or a {@link java.time.format.DateTimeFormatter} pattern.
     */
    String value() default "";

    /**
     * The IETF language tag for month and day names.
     */
    String locale() default "";
}
