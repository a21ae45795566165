package jsontime.configuration;

import java.util.Locale;

import lombok.Getter;

@Getter
public class UnknownAliasException extends ConfigException {

    public enum Kind {
        FORMAT,
        ZONE
    }

    private final Kind kind;
    private final String alias;

    UnknownAliasException(Kind kind, String alias) {
        super(String.format("Unknown %s alias \"%s\"", kind.name().toLowerCase(Locale.ENGLISH), alias));
        this.kind = kind;
        this.alias = alias;
    }

}
