package jsontime.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleDeserializers;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.module.SimpleSerializers;

import jsontime.configuration.TimeFormatConfig;
import jsontime.datetime.TemporalConverter;

/**
 * Writes and reads the temporal types handled by {@link TemporalConverter} using the layouts
 * and zones of a {@link TimeFormatConfig}. Property annotations {@link jsontime.TimeFormat} and
 * {@link jsontime.TimeLocation} override the configuration defaults.
 * <p>
 * It must be registered after {@link com.fasterxml.jackson.datatype.jsr310.JavaTimeModule}, so
 * it takes precedence for the types it handles.
 */
public class TimeFormatModule extends SimpleModule {

    private final transient TimeFormatConfig config;

    public TimeFormatModule(TimeFormatConfig config) {
        super("TimeFormatModule", new Version(1, 0, 0, null, "fr.jsontime", "jsontime-core"));
        this.config = config;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        SimpleSerializers sers = new SimpleSerializers();
        SimpleDeserializers desers = new SimpleDeserializers();
        TemporalConverter.ALL.forEach(c -> addConverter(sers, desers, c));
        context.addSerializers(sers);
        context.addDeserializers(desers);
    }

    private <T> void addConverter(SimpleSerializers sers, SimpleDeserializers desers, TemporalConverter<T> converter) {
        sers.addSerializer(converter.getType(), new TemporalSerializer<>(config, converter));
        desers.addDeserializer(converter.getType(), new TemporalDeserializer<>(config, converter));
    }

}
