/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import io.walstream.WalStreamException;

/**
 * Signals text that is not a valid log sequence number.
 */
public class LsnFormatException extends WalStreamException {

    private static final long serialVersionUID = 1L;

    public LsnFormatException(String message) {
        super(message);
    }

    public LsnFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
