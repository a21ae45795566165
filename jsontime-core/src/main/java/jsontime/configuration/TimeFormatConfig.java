package jsontime.configuration;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jsontime.Helpers;
import jsontime.datetime.DatetimeProcessor;
import jsontime.datetime.NamedPatterns;
import jsontime.datetime.TemporalConverter;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * The time formats settings used by a mapper: the default layout, zone and locale, the layout and
 * zone aliases and the per-type default layouts.
 * <p>
 * It's immutable once built, use {@link #toBuilder()} to derive a new configuration.
 */
@Getter
public class TimeFormatConfig {

    private static final Logger logger = LogManager.getLogger();

    public static final String PROPERTIES_PREFIX = "timeformat.";
    public static final String PROPERTY_LAYOUT = PROPERTIES_PREFIX + "layout";
    public static final String PROPERTY_ZONE = PROPERTIES_PREFIX + "zone";
    public static final String PROPERTY_LOCALE = PROPERTIES_PREFIX + "locale";
    public static final String PROPERTY_FORMAT_ALIAS = PROPERTIES_PREFIX + "alias.format.";
    public static final String PROPERTY_ZONE_ALIAS = PROPERTIES_PREFIX + "alias.zone.";
    public static final String PROPERTY_TYPE_LAYOUT = PROPERTIES_PREFIX + "type.";

    public static final String UTC_ALIAS = "UTC";
    public static final String LOCAL_ALIAS = "Local";

    @Data
    private static class DatetimeProcessorKey {
        private final String layout;
        private final ZoneId zone;
        private final Locale locale;
    }

    @Setter
    @Accessors(chain = true)
    public static class Builder {
        private String layout = NamedPatterns.RFC3339;
        private ZoneId zone = ZoneId.systemDefault();
        private Locale locale = Locale.ENGLISH;
        @Setter(AccessLevel.NONE)
        private final Map<String, String> formatAliases = new LinkedHashMap<>();
        @Setter(AccessLevel.NONE)
        private final Map<String, ZoneId> zoneAliases = new LinkedHashMap<>();
        @Setter(AccessLevel.NONE)
        private final Map<Class<?>, String> typeLayouts = new LinkedHashMap<>();

        private Builder() {
            zoneAliases.put(UTC_ALIAS, ZoneOffset.UTC);
            zoneAliases.put(LOCAL_ALIAS, ZoneId.systemDefault());
        }

        private Builder(TimeFormatConfig config) {
            layout = config.layout;
            zone = config.zone;
            locale = config.locale;
            formatAliases.putAll(config.formatAliases);
            zoneAliases.putAll(config.zoneAliases);
            typeLayouts.putAll(config.typeLayouts);
        }

        /**
         * Set the layout and zone used by properties that don't declare them.
         */
        public Builder defaultTimeFormat(String layout, ZoneId zone) {
            this.layout = layout;
            this.zone = zone;
            return this;
        }

        /**
         * Register a layout alias, replacing any previous one with the same name.
         */
        public Builder formatAlias(String name, String layout) {
            String previous = formatAliases.put(name, layout);
            if (previous != null && ! previous.equals(layout)) {
                logger.debug("Layout alias \"{}\" changed from \"{}\" to \"{}\"", name, previous, layout);
            } else {
                logger.debug("Layout alias \"{}\" registered as \"{}\"", name, layout);
            }
            return this;
        }

        /**
         * Register a zone alias, replacing any previous one with the same name.
         */
        public Builder zoneAlias(String name, ZoneId zone) {
            ZoneId previous = zoneAliases.put(name, zone);
            if (previous != null && ! previous.equals(zone)) {
                logger.debug("Zone alias \"{}\" changed from {} to {}", name, previous, zone);
            } else {
                logger.debug("Zone alias \"{}\" registered as {}", name, zone);
            }
            return this;
        }

        /**
         * Set the default layout for a temporal type, used instead of the default layout.
         */
        public Builder typeLayout(Class<?> type, String layout) {
            typeLayouts.put(type, layout);
            return this;
        }

        /**
         * Read the settings from a properties map. Only keys starting with
         * {@value TimeFormatConfig#PROPERTIES_PREFIX} are used.
         * @throws ConfigException if a key is not a known setting or if a value is invalid
         */
        public Builder properties(Map<String, Object> properties) {
            Map<String, Object> props = new HashMap<>(properties);
            props.forEach((k, v) -> {
                if (v == null && k.startsWith(PROPERTIES_PREFIX)) {
                    throw new ConfigException("Missing value for time format property \"" + k + "\"");
                }
            });
            Optional.ofNullable(props.remove(PROPERTY_LAYOUT)).map(Object::toString).ifPresent(this::setLayout);
            Optional.ofNullable(props.remove(PROPERTY_ZONE)).map(TimeFormatConfig::toZoneId).ifPresent(this::setZone);
            Optional.ofNullable(props.remove(PROPERTY_LOCALE)).map(TimeFormatConfig::toLocale).ifPresent(this::setLocale);
            props.forEach((k, v) -> {
                if (k.startsWith(PROPERTY_FORMAT_ALIAS)) {
                    formatAlias(k.substring(PROPERTY_FORMAT_ALIAS.length()), v.toString());
                } else if (k.startsWith(PROPERTY_ZONE_ALIAS)) {
                    zoneAlias(k.substring(PROPERTY_ZONE_ALIAS.length()), toZoneId(v));
                } else if (k.startsWith(PROPERTY_TYPE_LAYOUT)) {
                    String typeName = k.substring(PROPERTY_TYPE_LAYOUT.length());
                    TemporalConverter<?> converter = TemporalConverter.forName(typeName)
                                                                      .orElseThrow(() -> new ConfigException("Not a temporal type: " + typeName));
                    typeLayout(converter.getType(), v.toString());
                } else if (k.startsWith(PROPERTIES_PREFIX)) {
                    throw new ConfigException("Unknown time format property \"" + k + "\"");
                }
            });
            return this;
        }

        public TimeFormatConfig build() {
            return new TimeFormatConfig(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TimeFormatConfig defaults() {
        return new Builder().build();
    }

    private final String layout;
    private final ZoneId zone;
    private final Locale locale;
    private final Map<String, String> formatAliases;
    private final Map<String, ZoneId> zoneAliases;
    private final Map<Class<?>, String> typeLayouts;
    @Getter(AccessLevel.NONE)
    private final Map<DatetimeProcessorKey, ResolvedTimeFormat> processorsCache = new ConcurrentHashMap<>();

    private TimeFormatConfig(Builder builder) {
        if (builder.layout == null || builder.zone == null || builder.locale == null) {
            throw new ConfigException("Default layout, zone and locale are required");
        }
        this.layout = builder.layout;
        this.zone = builder.zone;
        this.locale = builder.locale;
        this.formatAliases = Map.copyOf(builder.formatAliases);
        this.zoneAliases = Map.copyOf(builder.zoneAliases);
        this.typeLayouts = Map.copyOf(builder.typeLayouts);
        // Check layouts
        resolve(DeclaredTimeFormat.NONE, Object.class);
        formatAliases.values().forEach(this::checkLayout);
        typeLayouts.values().forEach(this::checkLayout);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean hasFormatAlias(String name) {
        return formatAliases.containsKey(name);
    }

    public boolean hasZoneAlias(String name) {
        return zoneAliases.containsKey(name);
    }

    /**
     * @throws UnknownAliasException if no layout alias is registered with this name
     */
    public String getFormatAlias(String name) {
        String aliased = formatAliases.get(name);
        if (aliased == null) {
            throw new UnknownAliasException(UnknownAliasException.Kind.FORMAT, name);
        }
        return aliased;
    }

    /**
     * @throws UnknownAliasException if no zone alias is registered with this name
     */
    public ZoneId getZoneAlias(String name) {
        ZoneId aliased = zoneAliases.get(name);
        if (aliased == null) {
            throw new UnknownAliasException(UnknownAliasException.Kind.ZONE, name);
        }
        return aliased;
    }

    /**
     * Resolve a layout alias, or return the name unchanged if it's not an alias.
     */
    public String resolveLayout(String name) {
        return hasFormatAlias(name) ? getFormatAlias(name) : name;
    }

    /**
     * Resolve a zone alias, or else parse the name as a zone ID.
     * @throws ConfigException if it's neither an alias nor a valid zone ID
     */
    public ZoneId resolveZone(String name) {
        if (hasZoneAlias(name)) {
            return getZoneAlias(name);
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException ex) {
            throw new ConfigException(String.format("Unknown zone alias or identifier \"%s\": %s", name, Helpers.resolveThrowableException(ex)), ex);
        }
    }

    /**
     * Resolve the effective layout, zone and locale of a property. Declared facets are used first,
     * then the layout registered for the value type, and then the defaults.
     * @param declared what the property declares
     * @param valueType the class of the property value
     * @throws ConfigException if the declaration uses an invalid zone, locale or pattern
     */
    public ResolvedTimeFormat resolve(DeclaredTimeFormat declared, Class<?> valueType) {
        String layoutName = Optional.ofNullable(declared.getFormat()).orElseGet(() -> typeLayout(valueType));
        ZoneId resolvedZone = Optional.ofNullable(declared.getLocation()).map(this::resolveZone).orElse(zone);
        Locale resolvedLocale = Optional.ofNullable(declared.getLocale()).map(TimeFormatConfig::toLocale).orElse(locale);
        DatetimeProcessorKey key = new DatetimeProcessorKey(resolveLayout(layoutName), resolvedZone, resolvedLocale);
        ResolvedTimeFormat resolved = processorsCache.get(key);
        if (resolved == null) {
            resolved = new ResolvedTimeFormat(key.layout, key.zone, key.locale, newProcessor(key));
            ResolvedTimeFormat previous = processorsCache.putIfAbsent(key, resolved);
            if (previous != null) {
                resolved = previous;
            } else {
                logger.debug("Resolved {} for {} as {}", declared, valueType.getName(), resolved);
            }
        }
        return resolved;
    }

    private String typeLayout(Class<?> valueType) {
        for (Class<?> c = valueType; c != null; c = c.getSuperclass()) {
            String typeLayout = typeLayouts.get(c);
            if (typeLayout != null) {
                return typeLayout;
            }
        }
        return layout;
    }

    private void checkLayout(String layoutName) {
        newProcessor(new DatetimeProcessorKey(resolveLayout(layoutName), zone, locale));
    }

    private DatetimeProcessor newProcessor(DatetimeProcessorKey key) {
        try {
            return DatetimeProcessor.of(key.layout).withDefaultZone(key.zone).withLocale(key.locale);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(String.format("Invalid layout \"%s\": %s", key.layout, Helpers.resolveThrowableException(ex)), ex);
        }
    }

    private static ZoneId toZoneId(Object value) {
        if (value instanceof ZoneId) {
            return (ZoneId) value;
        }
        try {
            return ZoneId.of(value.toString());
        } catch (DateTimeException ex) {
            throw new ConfigException(String.format("Invalid zone \"%s\": %s", value, Helpers.resolveThrowableException(ex)), ex);
        }
    }

    private static Locale toLocale(Object value) {
        if (value instanceof Locale) {
            return (Locale) value;
        }
        Locale parsed = Locale.forLanguageTag(value.toString());
        if (parsed.getLanguage().isEmpty()) {
            throw new ConfigException("Invalid locale \"" + value + "\"");
        }
        return parsed;
    }

}
