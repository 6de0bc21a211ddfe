/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

/**
 * The kind of change carried by a {@link ChangeEvent}.
 */
public enum Operation {
    INSERT,
    UPDATE,
    DELETE,
    BEGIN,
    COMMIT;

    /**
     * @return whether the operation changes a row, as opposed to marking a transaction boundary
     */
    public boolean isDataChange() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }
}
