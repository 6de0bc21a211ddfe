/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.util.Objects;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.walstream.annotation.Immutable;
import io.walstream.config.Configuration;
import io.walstream.config.Field;

/**
 * The parameters needed to reach the source database. Instances are immutable; the {@code with...} methods
 * return modified copies.
 * <p>
 * The underlying {@link Configuration} may carry further keys, e.g. the {@link StreamConfig} tuning options,
 * which are preserved by every copy.
 */
@Immutable
public class ConnectionConfig {

    public static final String DATABASE_CONFIG_PREFIX = "database.";

    public static final Field HOSTNAME = Field.create(DATABASE_CONFIG_PREFIX + "hostname")
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("localhost")
            .required()
            .withDescription("Resolvable hostname or IP address of the database server.");

    public static final Field PORT = Field.create(DATABASE_CONFIG_PREFIX + "port")
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault(5432)
            .withValidation(Field.RangeValidator.between(1, 65535))
            .withDescription("Port of the database server.");

    public static final Field USER = Field.create(DATABASE_CONFIG_PREFIX + "user")
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault("postgres")
            .required()
            .withDescription("Name of the database user to be used when connecting to the database.");

    public static final Field PASSWORD = Field.create(DATABASE_CONFIG_PREFIX + "password")
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the database user to be used when connecting to the database.");

    public static final Field DATABASE_NAME = Field.create(DATABASE_CONFIG_PREFIX + "dbname")
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("The name of the database from which changes are streamed.");

    public static final Field.Set ALL_FIELDS = Field.setOf(HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME);

    private final Configuration config;

    public ConnectionConfig(Configuration config) {
        this.config = Objects.requireNonNull(config, "The configuration may not be null");
    }

    /**
     * Connection parameters with default host, port and user for the given database.
     *
     * @param databaseName the database to stream from
     * @return the configuration; never null
     */
    public static ConnectionConfig forDatabase(String databaseName) {
        return new ConnectionConfig(Configuration.create()
                .with(HOSTNAME, HOSTNAME.defaultValueAsString())
                .with(PORT, PORT.defaultValueAsString())
                .with(USER, USER.defaultValueAsString())
                .with(DATABASE_NAME, databaseName)
                .build());
    }

    public ConnectionConfig withHostname(String hostname) {
        return new ConnectionConfig(config.edit().with(HOSTNAME, hostname).build());
    }

    public ConnectionConfig withPort(int port) {
        return new ConnectionConfig(config.edit().with(PORT, port).build());
    }

    public ConnectionConfig withUser(String user) {
        return new ConnectionConfig(config.edit().with(USER, user).build());
    }

    public ConnectionConfig withPassword(String password) {
        return new ConnectionConfig(config.edit().with(PASSWORD, password).build());
    }

    public String hostname() {
        return config.getString(HOSTNAME);
    }

    public int port() {
        return config.getInteger(PORT);
    }

    public String user() {
        return config.getString(USER);
    }

    public String password() {
        return config.getString(PASSWORD);
    }

    public String databaseName() {
        return config.getString(DATABASE_NAME);
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * Check the connection parameters.
     *
     * @throws io.walstream.config.InvalidConfigurationException if any of them is missing or malformed
     */
    public void validate() {
        config.validateAndThrow(ALL_FIELDS, "Invalid connection configuration");
    }

    public static ConfigDef configDef() {
        return Field.group(new ConfigDef(), "Postgres", ALL_FIELDS.asArray());
    }

    @Override
    public String toString() {
        return "ConnectionConfig " + config.withMaskedPasswords();
    }
}
