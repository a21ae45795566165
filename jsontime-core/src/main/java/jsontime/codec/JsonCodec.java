package jsontime.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import jsontime.Helpers;
import jsontime.configuration.TimeFormatConfig;
import jsontime.jackson.JacksonBuilder;
import lombok.Getter;

/**
 * Marshal and unmarshal beans to JSON, with temporal properties formatted according to a
 * {@link TimeFormatConfig}. Instances are thread safe.
 */
public class JsonCodec {

    private static final Logger logger = LogManager.getLogger();

    public static JsonCodec of(TimeFormatConfig config) {
        return new JsonCodec(config);
    }

    @Getter
    private final TimeFormatConfig config;
    @Getter
    private final JsonMapper mapper;

    private JsonCodec(TimeFormatConfig config) {
        this.config = config;
        this.mapper = JacksonBuilder.get(JsonMapper.class)
                                    .timeFormats(config)
                                    .feature(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                                    .feature(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                                    .getMapper();
    }

    public byte[] marshal(Object value) throws EncodeException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException ex) {
            throw encodeFailure(value, ex);
        }
    }

    public String marshalToString(Object value) throws EncodeException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw encodeFailure(value, ex);
        }
    }

    public <T> T unmarshal(byte[] data, Class<T> type) throws DecodeException {
        try {
            return mapper.readValue(data, type);
        } catch (IOException ex) {
            throw decodeFailure(type.getName(), ex);
        }
    }

    public <T> T unmarshal(String data, Class<T> type) throws DecodeException {
        return unmarshal(data.getBytes(StandardCharsets.UTF_8), type);
    }

    public <T> T unmarshal(byte[] data, TypeReference<T> type) throws DecodeException {
        try {
            return mapper.readValue(data, type);
        } catch (IOException ex) {
            throw decodeFailure(type.getType().getTypeName(), ex);
        }
    }

    /**
     * Unmarshal into an existing instance, only the properties present in the JSON text are updated.
     * @return the updated instance
     */
    public <T> T unmarshalInto(byte[] data, T target) throws DecodeException {
        try {
            return mapper.readerForUpdating(target).readValue(data);
        } catch (IOException ex) {
            throw decodeFailure(target.getClass().getName(), ex);
        }
    }

    private EncodeException encodeFailure(Object value, JsonProcessingException ex) {
        String message = String.format("Failed to encode %s: %s", value == null ? "null" : value.getClass().getName(), Helpers.resolveThrowableException(ex));
        logger.debug(message);
        return new EncodeException(message, ex);
    }

    private DecodeException decodeFailure(String typeName, IOException ex) {
        String message = String.format("Failed to decode %s: %s", typeName, Helpers.resolveThrowableException(ex));
        logger.debug(message);
        return new DecodeException(message, ex);
    }

}
