/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.config;

import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigValue;

import io.walstream.annotation.Immutable;
import io.walstream.util.Strings;

/**
 * Read-only string options of a stream, usually looked up through their {@link Field} definitions so that defaults
 * apply. Instances come from {@link #from(Properties)}, {@link #from(Map)} or a {@link #create() builder}; a changed
 * copy is made with {@link #edit()}.
 * <p>
 * Values of keys ending in {@code password} never show up in {@link Object#toString()}.
 */
@Immutable
public interface Configuration {

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    String MASKED_VALUE = "********";

    /**
     * Collects options for a new {@link Configuration}.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        /**
         * Set the value of a key; a {@code null} value removes the key.
         *
         * @return this builder; never null
         */
        public Builder with(String key, String value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value);
            }
            return this;
        }

        public Builder with(String key, Object value) {
            return with(key, value != null ? value.toString() : null);
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, int value) {
            return with(field.name(), Integer.toString(value));
        }

        public Builder with(Field field, long value) {
            return with(field.name(), Long.toString(value));
        }

        public Builder apply(Consumer<Builder> change) {
            change.accept(this);
            return this;
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    static Builder create() {
        return new Builder();
    }

    static Configuration empty() {
        return from(new Properties());
    }

    /**
     * @param properties the options to copy; may be null
     * @return a configuration that later changes to {@code properties} do not affect; never null
     */
    static Configuration from(Properties properties) {
        final Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return Collections.unmodifiableSet(props.stringPropertyNames());
            }

            @Override
            public String toString() {
                return withMaskedPasswords().asMap().toString();
            }
        };
    }

    /**
     * Copy a map of options. Collection values are joined with commas, {@code null} values are skipped and everything
     * else is stored as its {@code toString()}.
     *
     * @param properties the options to copy; may be null
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        final Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (value instanceof Collection<?>) {
                    props.setProperty(key, Strings.join(",", (Collection<?>) value));
                }
                else if (value != null) {
                    props.setProperty(key, value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * @return a builder holding the options of this configuration; never null
     */
    default Builder edit() {
        final Properties props = new Properties();
        props.putAll(asMap());
        return new Builder(props);
    }

    Set<String> keys();

    /**
     * @return the value of the key, or {@code null} if it is not set
     */
    String getString(String key);

    default String getString(String key, String defaultValue) {
        final String value = getString(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @return the value of the field, or its {@link Field#defaultValue() default} if it is not set
     */
    default String getString(Field field) {
        return getString(field.name(), field.defaultValueAsString());
    }

    /**
     * @return the value or default of the field as a {@link Long} or, failing that, a {@link Double}; {@code null} if
     *         there is neither or the value is not a number
     */
    default Number getNumber(Field field) {
        final String value = getString(field);
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        }
        catch (NumberFormatException notLong) {
            try {
                return Double.valueOf(value.trim());
            }
            catch (NumberFormatException notNumber) {
                return null;
            }
        }
    }

    /**
     * @return the value of the key, or the supplied default if it is not set or not an integer
     */
    default Integer getInteger(String key, IntSupplier defaultValueSupplier) {
        final String value = getString(key);
        if (value != null) {
            try {
                return Integer.valueOf(value.trim());
            }
            catch (NumberFormatException e) {
                // use the default
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsInt() : null;
    }

    /**
     * @return the value of the key, or the supplied default if it is not set or not a long
     */
    default Long getLong(String key, LongSupplier defaultValueSupplier) {
        final String value = getString(key);
        if (value != null) {
            try {
                return Long.valueOf(value.trim());
            }
            catch (NumberFormatException e) {
                // use the default
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsLong() : null;
    }

    /**
     * @throws NumberFormatException if the field is not set and has no numeric default
     */
    default int getInteger(Field field) {
        return getInteger(field.name(), () -> Integer.parseInt(field.defaultValueAsString()));
    }

    /**
     * @throws NumberFormatException if the field is not set and has no numeric default
     */
    default long getLong(Field field) {
        return getLong(field.name(), () -> Long.parseLong(field.defaultValueAsString()));
    }

    default Duration getDuration(Field field, TemporalUnit unit) {
        return Duration.of(getLong(field), unit);
    }

    /**
     * @return a view of this configuration in which the values of password keys are replaced with {@link #MASKED_VALUE}
     */
    default Configuration withMaskedPasswords() {
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return Configuration.this.keys();
            }

            @Override
            public String getString(String key) {
                return PASSWORD_PATTERN.matcher(key).matches() ? MASKED_VALUE : Configuration.this.getString(key);
            }

            @Override
            public String toString() {
                return asMap().toString();
            }
        };
    }

    /**
     * @return the options as a map sorted by key; never null
     */
    default Map<String, String> asMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        keys().stream().sorted().forEach(key -> {
            final String value = getString(key);
            if (value != null) {
                map.put(key, value);
            }
        });
        return map;
    }

    /**
     * Validate the given fields; options that are not among them are ignored.
     *
     * @return the outcome for each field keyed by field name; never null
     */
    default Map<String, ConfigValue> validate(Field.Set fields) {
        final Map<String, ConfigValue> results = new HashMap<>();
        fields.forEach(field -> field.validate(this, results));
        return results;
    }

    /**
     * Validate the given fields and fail with every invalid value at once.
     *
     * @param fields the fields to check
     * @param message the start of the exception message, followed by the individual problems
     * @throws InvalidConfigurationException if any of the fields is invalid
     */
    default void validateAndThrow(Field.Set fields, String message) {
        final Map<String, ConfigValue> results = validate(fields);
        final List<String> problems = results.values().stream()
                .flatMap(value -> value.errorMessages().stream())
                .sorted()
                .collect(Collectors.toList());
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(message + ": " + Strings.join("; ", problems), results.values());
        }
    }
}
