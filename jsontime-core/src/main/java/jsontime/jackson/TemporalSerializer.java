package jsontime.jackson;

import java.io.IOException;
import java.time.DateTimeException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

import jsontime.Helpers;
import jsontime.configuration.ConfigException;
import jsontime.configuration.DeclaredTimeFormat;
import jsontime.configuration.ResolvedTimeFormat;
import jsontime.configuration.TimeFormatConfig;
import jsontime.datetime.TemporalConverter;

class TemporalSerializer<T> extends StdScalarSerializer<T> implements ContextualSerializer {

    private static final Logger logger = LogManager.getLogger();

    private final TimeFormatConfig config;
    private final TemporalConverter<T> converter;
    private final ResolvedTimeFormat format;

    TemporalSerializer(TimeFormatConfig config, TemporalConverter<T> converter) {
        this(config, converter, config.resolve(DeclaredTimeFormat.NONE, converter.getType()));
    }

    private TemporalSerializer(TimeFormatConfig config, TemporalConverter<T> converter, ResolvedTimeFormat format) {
        super(converter.getType());
        this.config = config;
        this.converter = converter;
        this.format = format;
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) throws JsonMappingException {
        DeclaredTimeFormat declared = PropertyTimeFormats.declared(property, findFormatOverrides(prov, property, handledType()));
        if (declared.isEmpty()) {
            return this;
        }
        try {
            ResolvedTimeFormat resolved = config.resolve(declared, handledType());
            logger.debug("Property \"{}\" written with {}", property::getName, () -> resolved);
            return resolved == format ? this : new TemporalSerializer<>(config, converter, resolved);
        } catch (ConfigException ex) {
            String message = String.format("Unusable time format for property \"%s\": %s", property.getName(), Helpers.resolveThrowableException(ex));
            throw InvalidDefinitionException.from(prov.getGenerator(), message, prov.constructType(handledType()));
        }
    }

    @Override
    public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        String text;
        try {
            text = format.format(converter.toZoned(value, format.getZone()));
        } catch (DateTimeException ex) {
            throw JsonMappingException.from(gen, String.format("Unable to write %s with layout \"%s\": %s", handledType().getSimpleName(), format.getLayout(), Helpers.resolveThrowableException(ex)), ex);
        }
        if (format.isNumeric()) {
            gen.writeNumber(text);
        } else {
            gen.writeString(text);
        }
    }

}
