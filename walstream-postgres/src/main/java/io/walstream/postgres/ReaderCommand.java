/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.walstream.annotation.Immutable;
import io.walstream.util.Strings;

/**
 * The invocation of the external reader process for one replication slot.
 * <p>
 * The password is not part of the command line, which is visible to every user of the host; it is handed over
 * in the {@value #PASSWORD_ENVIRONMENT_VARIABLE} environment variable, which libpq reads.
 */
@Immutable
public class ReaderCommand {

    public static final String PASSWORD_ENVIRONMENT_VARIABLE = "PGPASSWORD";
    public static final String OUTPUT_FORMAT = "decoderbufs-framed";

    private final String executable;
    private final ConnectionConfig connection;
    private final String slotName;
    private final Lsn startPosition;

    public ReaderCommand(String executable, ConnectionConfig connection, String slotName, Lsn startPosition) {
        this.executable = executable;
        this.connection = connection;
        this.slotName = slotName;
        this.startPosition = startPosition;
    }

    /**
     * @return the program and its arguments
     */
    public List<String> toCommandLine() {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--host=" + connection.hostname());
        command.add("--port=" + connection.port());
        command.add("--username=" + connection.user());
        command.add("--dbname=" + connection.databaseName());
        command.add("--slot=" + slotName);
        command.add("--startpos=" + startPosition.asString());
        command.add("--format=" + OUTPUT_FORMAT);
        return command;
    }

    /**
     * @return the variables to add to the environment of the reader; empty if there is no password
     */
    public Map<String, String> environment() {
        final String password = connection.password();
        if (Strings.isNullOrEmpty(password)) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(PASSWORD_ENVIRONMENT_VARIABLE, password);
    }

    /**
     * @return a process builder for the reader, with its standard error going to the one of this process
     */
    public ProcessBuilder toProcessBuilder() {
        final ProcessBuilder builder = new ProcessBuilder(toCommandLine());
        builder.environment().putAll(environment());
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);
        builder.redirectOutput(ProcessBuilder.Redirect.PIPE);
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        return builder;
    }

    @Override
    public String toString() {
        return Strings.join(" ", toCommandLine());
    }
}
