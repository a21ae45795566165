package jsontime.jackson;

import java.io.IOException;
import java.time.DateTimeException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.type.LogicalType;

import jsontime.Helpers;
import jsontime.configuration.ConfigException;
import jsontime.configuration.DeclaredTimeFormat;
import jsontime.configuration.ResolvedTimeFormat;
import jsontime.configuration.TimeFormatConfig;
import jsontime.datetime.TemporalConverter;

class TemporalDeserializer<T> extends StdScalarDeserializer<T> implements ContextualDeserializer {

    private static final Logger logger = LogManager.getLogger();

    private final TimeFormatConfig config;
    private final TemporalConverter<T> converter;
    private final ResolvedTimeFormat format;

    TemporalDeserializer(TimeFormatConfig config, TemporalConverter<T> converter) {
        this(config, converter, config.resolve(DeclaredTimeFormat.NONE, converter.getType()));
    }

    private TemporalDeserializer(TimeFormatConfig config, TemporalConverter<T> converter, ResolvedTimeFormat format) {
        super(converter.getType());
        this.config = config;
        this.converter = converter;
        this.format = format;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) throws JsonMappingException {
        DeclaredTimeFormat declared = PropertyTimeFormats.declared(property, findFormatOverrides(ctxt, property, handledType()));
        if (declared.isEmpty()) {
            return this;
        }
        try {
            ResolvedTimeFormat resolved = config.resolve(declared, handledType());
            logger.debug("Property \"{}\" read with {}", property::getName, () -> resolved);
            return resolved == format ? this : new TemporalDeserializer<>(config, converter, resolved);
        } catch (ConfigException ex) {
            String message = String.format("Unusable time format for property \"%s\": %s", property.getName(), Helpers.resolveThrowableException(ex));
            throw InvalidDefinitionException.from(ctxt.getParser(), message, ctxt.constructType(handledType()));
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text;
        if (p.hasToken(JsonToken.VALUE_STRING)) {
            text = p.getText();
        } else if (format.isNumeric() && (p.hasToken(JsonToken.VALUE_NUMBER_INT) || p.hasToken(JsonToken.VALUE_NUMBER_FLOAT))) {
            text = p.getText();
        } else {
            return (T) ctxt.handleUnexpectedToken(handledType(), p);
        }
        try {
            logger.trace("Parsing \"{}\" with {}", text, format);
            return converter.fromZoned(format.parse(text));
        } catch (DateTimeException ex) {
            String message = String.format("Cannot read %s from \"%s\" with layout \"%s\": %s", handledType().getSimpleName(), text, format.getLayout(), Helpers.resolveThrowableException(ex));
            throw InvalidFormatException.from(p, message, text, handledType());
        }
    }

    @Override
    public LogicalType logicalType() {
        return LogicalType.DateTime;
    }

}
