/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.junit.jupiter.api.Test;

public class FieldTest {

    @Test
    public void shouldCreateFieldSetWithoutDuplicates() {
        Field a = Field.create("a");
        Field b = Field.create("b");
        Field.Set set = Field.setOf(a, b).with(Field.create("a"), Field.create("c"));
        assertThat(set.allFieldNames()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(set.fieldWithName("b")).isSameAs(b);
        assertThat(set.fieldWithName("d")).isNull();
    }

    @Test
    public void shouldBeImmutable() {
        Field field = Field.create("a").withDefault(1).withType(Type.INT);
        Field other = field.withDefault(2);
        assertThat(field.defaultValue()).isEqualTo(1);
        assertThat(other.defaultValue()).isEqualTo(2);
        assertThat(other.type()).isEqualTo(Type.INT);
        assertThat(other).isEqualTo(field);
    }

    @Test
    public void shouldValidateTypeAndCustomRules() {
        Field field = Field.create("size").withType(Type.INT).withValidation(Field::isPositiveInteger);
        List<String> problems = new ArrayList<>();
        Field.ValidationOutput output = (f, value, problem) -> problems.add(problem);

        assertThat(field.validate(Configuration.create().with(field, 10).build(), output)).isTrue();
        assertThat(field.validate(Configuration.create().with(field, -1).build(), output)).isFalse();
        assertThat(field.validate(Configuration.create().with(field, "ten").build(), output)).isFalse();
        assertThat(problems).containsExactly(
                "A positive, non-zero integer value is expected",
                "An integer is expected",
                "A positive, non-zero integer value is expected");
    }

    @Test
    public void shouldRequireValue() {
        Field field = Field.create("name").required();
        assertThat(field.isRequired()).isTrue();
        assertThat(field.validate(Configuration.empty(), (f, v, p) -> {
        })).isFalse();
        assertThat(field.validate(Configuration.create().with(field, "x").build(), (f, v, p) -> {
        })).isTrue();
    }

    @Test
    public void shouldCheckRange() {
        Field field = Field.create("port").withType(Type.INT).withValidation(Field.RangeValidator.between(1, 65535));
        assertThat(field.validate(Configuration.create().with(field, 1).build(), (f, v, p) -> {
        })).isTrue();
        assertThat(field.validate(Configuration.create().with(field, 0).build(), (f, v, p) -> {
        })).isFalse();
        assertThat(field.validate(Configuration.create().with(field, 65536).build(), (f, v, p) -> {
        })).isFalse();
    }

    @Test
    public void shouldDefineConfigDefGroup() {
        Field host = Field.create("database.hostname").withDisplayName("Hostname").withImportance(Importance.HIGH).withDefault("localhost");
        Field port = Field.create("database.port").withType(Type.INT).withDefault(5432);
        ConfigDef configDef = Field.group(new ConfigDef(), "Connection", host, port);

        assertThat(configDef.names()).containsExactlyInAnyOrder("database.hostname", "database.port");
        assertThat(configDef.configKeys().get("database.hostname").importance).isEqualTo(Importance.HIGH);
        assertThat(configDef.configKeys().get("database.port").defaultValue).isEqualTo(5432);
        assertThat(configDef.configKeys().get("database.port").orderInGroup).isEqualTo(2);
    }
}
