/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.util.OptionalInt;

import io.walstream.WalStreamException;

/**
 * Signals that the reader process ended, or its output closed, while the stream was expected to keep running.
 */
public class UnexpectedTerminationException extends WalStreamException {

    private static final long serialVersionUID = 1L;

    private final Integer exitCode;

    public UnexpectedTerminationException(String message, Integer exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public UnexpectedTerminationException(String message, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /**
     * @return the exit code of the reader, empty if it was not known when the stream ended
     */
    public OptionalInt exitCode() {
        return exitCode != null ? OptionalInt.of(exitCode) : OptionalInt.empty();
    }
}
