/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.config;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongPredicate;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.apache.kafka.common.config.ConfigValue;

import io.walstream.annotation.Immutable;

/**
 * The definition of one option of a {@link Configuration}: its key, how it is presented, its default and the rules
 * a value has to follow. Definitions are immutable; every {@code with...} method returns a modified copy.
 */
@Immutable
public final class Field {

    public static Set setOf(Field... fields) {
        return Set.EMPTY.with(fields);
    }

    /**
     * An ordered set of fields, unique by name.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {

        private static final Set EMPTY = new Set(Collections.emptyMap());

        private final Map<String, Field> fieldsByName;

        private Set(Map<String, Field> fieldsByName) {
            this.fieldsByName = fieldsByName;
        }

        /**
         * @return the field with the given name, or {@code null} if the set has none
         */
        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        /**
         * Get a set holding the fields of this set followed by the supplied ones. A field whose name is already present
         * keeps its place.
         *
         * @param fields the fields to add; null elements are skipped
         * @return the combined set; never null
         */
        public Set with(Field... fields) {
            final Map<String, Field> combined = new LinkedHashMap<>(fieldsByName);
            for (Field field : fields) {
                if (field != null) {
                    combined.putIfAbsent(field.name(), field);
                }
            }
            return combined.size() == fieldsByName.size() ? this : new Set(Collections.unmodifiableMap(combined));
        }

        public Set with(Set fields) {
            return with(fields.asArray());
        }

        public Field[] asArray() {
            return fieldsByName.values().toArray(new Field[0]);
        }

        public java.util.Set<String> allFieldNames() {
            return fieldsByName.keySet();
        }
    }

    /**
     * Receives the problems found while validating.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A rule for the value of a field.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Check the value the configuration holds for the field.
         *
         * @param config the configuration to check; never null
         * @param field the field whose value is checked; never null
         * @param problems receives every problem found; never null
         * @return the number of problems found, 0 if the value is acceptable
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    public static Field create(String name) {
        return new Field(new Definition(name));
    }

    /**
     * Register the given fields with a Kafka {@link ConfigDef}, numbered in the order given.
     *
     * @param configDef the definition to extend; may be null, in which case nothing happens
     * @param groupName the group the fields are listed under
     * @param fields the fields to register
     * @return the supplied definition
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        if (configDef == null) {
            return null;
        }
        int orderInGroup = 0;
        for (Field field : fields) {
            configDef.define(field.name(), field.type(), field.defaultValue(), null, field.importance(), field.description(),
                    groupName, ++orderInGroup, field.width(), field.displayName());
        }
        return configDef;
    }

    /**
     * The mutable state a field is derived from.
     */
    private static final class Definition {
        private final String name;
        private String displayName;
        private String description;
        private Supplier<Object> defaultValue = () -> null;
        private Validator validator;
        private Type type = Type.STRING;
        private Width width = Width.NONE;
        private Importance importance = Importance.MEDIUM;
        private boolean required;

        private Definition(String name) {
            this.name = Objects.requireNonNull(name, "The field name is required");
        }

        private Definition(Field field) {
            this(field.name);
            this.displayName = field.displayName;
            this.description = field.description;
            this.defaultValue = field.defaultValue;
            this.validator = field.validator;
            this.type = field.type;
            this.width = field.width;
            this.importance = field.importance;
            this.required = field.required;
        }
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Supplier<Object> defaultValue;
    private final Validator validator;
    private final Type type;
    private final Width width;
    private final Importance importance;
    private final boolean required;

    private Field(Definition definition) {
        this.name = definition.name;
        this.displayName = definition.displayName;
        this.description = definition.description;
        this.defaultValue = definition.defaultValue;
        this.validator = definition.validator;
        this.type = definition.type;
        this.width = definition.width;
        this.importance = definition.importance;
        this.required = definition.required;
    }

    private Field derive(Consumer<Definition> change) {
        final Definition definition = new Definition(this);
        change.accept(definition);
        return new Field(definition);
    }

    public String name() {
        return name;
    }

    /**
     * @return the default value, or {@code null} if the field has none
     */
    public Object defaultValue() {
        return defaultValue.get();
    }

    /**
     * @return the default value as text, or {@code null} if the field has none
     */
    public String defaultValueAsString() {
        final Object value = defaultValue();
        return value != null ? value.toString() : null;
    }

    public String description() {
        return description;
    }

    public String displayName() {
        return displayName;
    }

    public Width width() {
        return width;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Check the value of this field in the configuration: first that it can be read as the field's {@link #type()},
     * then against the field's own rules.
     *
     * @param config the configuration to check; may not be null
     * @param problems receives every problem found; may not be null
     * @return {@code true} if no problem was found
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        int errors = 0;
        final Validator typeValidator = validatorForType(type);
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    /**
     * Check the value of this field and record the outcome in the field's entry of {@code results}.
     */
    void validate(Configuration config, Map<String, ConfigValue> results) {
        final ConfigValue result = results.computeIfAbsent(name, ConfigValue::new);
        result.value(config.getString(this));
        validate(config, (field, value, problem) -> result.addErrorMessage(validationOutput(field, problem)));
    }

    public Field withDescription(String description) {
        return derive(d -> d.description = description);
    }

    public Field withDisplayName(String displayName) {
        return derive(d -> d.displayName = displayName);
    }

    public Field withWidth(Width width) {
        return derive(d -> d.width = width);
    }

    public Field withType(Type type) {
        return derive(d -> d.type = type);
    }

    public Field withImportance(Importance importance) {
        return derive(d -> d.importance = importance);
    }

    /**
     * @return a copy of this field that reports a missing or blank value as a problem
     */
    public Field required() {
        return derive(d -> d.required = true).withValidation(Field::isRequired);
    }

    public Field withDefault(String defaultValue) {
        return derive(d -> d.defaultValue = () -> defaultValue);
    }

    public Field withDefault(int defaultValue) {
        return derive(d -> d.defaultValue = () -> defaultValue);
    }

    public Field withDefault(long defaultValue) {
        return derive(d -> d.defaultValue = () -> defaultValue);
    }

    /**
     * @param validators rules checked in addition to the ones the field already has; null elements are skipped
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator combined = validator;
        for (Validator extra : validators) {
            if (extra != null) {
                combined = extra.and(combined);
            }
        }
        final Validator result = combined;
        return derive(d -> d.validator = result);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            return name.equals(((Field) obj).name);
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }

    private static Validator validatorForType(Type type) {
        switch (type) {
            case INT:
                return Field::isInteger;
            case LONG:
                return Field::isLong;
            default:
                return null;
        }
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> !value.trim().isEmpty(), "A value is required", true);
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> parses(value, Integer::parseInt, n -> true), "An integer is expected", false);
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> parses(value, Integer::parseInt, n -> n > 0),
                "A positive, non-zero integer value is expected", false);
    }

    public static int isLong(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> parses(value, Long::parseLong, n -> true), "A long value is expected", false);
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> parses(value, Long::parseLong, n -> n > 0),
                "A positive, non-zero long value is expected", false);
    }

    public static int isNonNegativeLong(Configuration config, Field field, ValidationOutput problems) {
        return check(config, field, problems, value -> parses(value, Long::parseLong, n -> n >= 0),
                "A non-negative long value is expected", false);
    }

    private static int check(Configuration config, Field field, ValidationOutput problems, Predicate<String> acceptable,
                             String expectation, boolean missingIsProblem) {
        final String value = config.getString(field);
        if (value == null ? !missingIsProblem : acceptable.test(value)) {
            return 0;
        }
        problems.accept(field, value, expectation);
        return 1;
    }

    private static boolean parses(String value, ToLongFunction<String> parser, LongPredicate condition) {
        try {
            return condition.test(parser.applyAsLong(value));
        }
        catch (NumberFormatException e) {
            return false;
        }
    }

    public static String validationOutput(Field field, String problem) {
        return String.format("The '%s' value is invalid: %s", field.name(), problem);
    }

    /**
     * Accepts numbers within an inclusive range. Values that are not numbers are left to the type check.
     */
    public static final class RangeValidator implements Validator {
        private final Number min;
        private final Number max;

        private RangeValidator(Number min, Number max) {
            this.min = Objects.requireNonNull(min);
            this.max = Objects.requireNonNull(max);
        }

        public static RangeValidator between(Number min, Number max) {
            return new RangeValidator(min, max);
        }

        @Override
        public int validate(Configuration config, Field field, ValidationOutput problems) {
            if (config.getString(field) == null) {
                problems.accept(field, null, "A value must be provided");
                return 1;
            }
            final Number value = config.getNumber(field);
            if (value == null) {
                return 0;
            }
            if (value.doubleValue() < min.doubleValue()) {
                problems.accept(field, value, "Value must be at least " + min);
                return 1;
            }
            if (value.doubleValue() > max.doubleValue()) {
                problems.accept(field, value, "Value must be no more than " + max);
                return 1;
            }
            return 0;
        }

        @Override
        public String toString() {
            return "[" + min + ",...," + max + "]";
        }
    }
}
