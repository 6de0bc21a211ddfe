/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream;

/**
 * Base exception raised by the streaming engine. Every failure reported by a stream, whether thrown
 * synchronously or delivered through its completion signal, is a subtype of this exception.
 */
public class WalStreamException extends RuntimeException {

    private static final long serialVersionUID = -3287161728420134618L;

    public WalStreamException() {
    }

    public WalStreamException(String message) {
        super(message);
    }

    public WalStreamException(Throwable cause) {
        super(cause);
    }

    public WalStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
