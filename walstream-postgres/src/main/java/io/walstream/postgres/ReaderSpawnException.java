/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import io.walstream.WalStreamException;

/**
 * Signals that the external reader process could not be launched.
 */
public class ReaderSpawnException extends WalStreamException {

    private static final long serialVersionUID = 1L;

    public ReaderSpawnException(String message) {
        super(message);
    }

    public ReaderSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
