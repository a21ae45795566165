package jsontime.jackson;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.jsontype.impl.StdTypeResolverBuilder;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.afterburner.AfterburnerModule;

import jsontime.Helpers;
import jsontime.configuration.TimeFormatConfig;

/**
 * Builds Jackson mappers with the default modules, and the time formats of a
 * {@link TimeFormatConfig} registered after them.
 */
public class JacksonBuilder<T extends ObjectMapper> {

    public static <T extends ObjectMapper> JacksonBuilder<T> get(Class<T> clazz) {
        try {
            Method builderMethod = clazz.getMethod("builder");
            @SuppressWarnings("unchecked")
            MapperBuilder<T,?> builder = (MapperBuilder<T, ?>) builderMethod.invoke(null);
            defaultConfiguration(builder);
            return new JacksonBuilder<>(builder);
        } catch (NoSuchMethodException | SecurityException | IllegalAccessException | InvocationTargetException ex) {
            throw new IllegalStateException("Unusable Jackson mapper " + clazz.getName() + ": " + Helpers.resolveThrowableException(ex), ex);
        }
    }

    public static void defaultConfiguration(MapperBuilder<?, ?> builder) {
        builder.setDefaultTyping(StdTypeResolverBuilder.noTypeInfoBuilder());
        builder.addModule(new JavaTimeModule());
        builder.addModule(new Jdk8Module());
        builder.addModule(new AfterburnerModule());
        builder.enable(StreamReadFeature.USE_FAST_DOUBLE_PARSER);
    }

    private final MapperBuilder<T,?> builder;
    private TimeFormatConfig timeFormats = null;

    private JacksonBuilder(MapperBuilder<T, ?> builder) {
        this.builder = builder;
    }

    /**
     * Use the layouts and zones of this configuration for the temporal types. The module is
     * registered last when the mapper is built, so it wins over {@link JavaTimeModule}.
     */
    public JacksonBuilder<T> timeFormats(TimeFormatConfig config) {
        this.timeFormats = config;
        return this;
    }

    public T getMapper() {
        if (timeFormats != null) {
            builder.addModule(new TimeFormatModule(timeFormats));
        }
        return builder.build();
    }

    public JacksonBuilder<T> feature(Enum<?> e) {
        return feature(e, true);
    }

    /**
     * Enable or disable a feature, using the matching {@code enable} or {@code disable} method
     * of the mapper builder.
     */
    public JacksonBuilder<T> feature(Enum<?> e, boolean state) {
        try {
            Object o = Array.newInstance(e.getDeclaringClass(), 1);
            Array.set(o, 0, e);
            Method m = builder.getClass().getMethod(state ? "enable" : "disable", o.getClass());
            m.invoke(builder, o);
        } catch (NoSuchMethodException | SecurityException | IllegalAccessException | IllegalArgumentException | InvocationTargetException ex) {
            throw new IllegalStateException("Unusable feature " + e.name() + ": " + Helpers.resolveThrowableException(ex), ex);
        }
        return this;
    }

}
