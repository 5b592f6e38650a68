package org.mozilla.automation.etp.config;

import java.util.Locale;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Remote Settings server a run targets.
 */
public enum ServerEnvironment {
    DEV,
    STAGE,
    PROD;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isProduction() {
        return this == PROD;
    }

    /**
     * @return the default server location for this environment
     */
    public String location(ExceptionsManagerConfig.RemoteSettingsConfig config) {
        return switch (this) {
            case DEV -> config.devLocation();
            case STAGE -> config.stageLocation();
            case PROD -> config.prodLocation();
        };
    }

    public static ServerEnvironment fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Server environment is required");
        }
        for (ServerEnvironment env : values()) {
            if (env.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return env;
            }
        }
        throw new IllegalArgumentException("Unknown server environment '%s' (expected dev, stage or prod)"
                .formatted(value));
    }

    @Override
    public String toString() {
        return value();
    }

    /** Case-insensitive conversion for --server */
    public static class Converter implements ITypeConverter<ServerEnvironment> {
        @Override
        public ServerEnvironment convert(String value) {
            try {
                return fromString(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
