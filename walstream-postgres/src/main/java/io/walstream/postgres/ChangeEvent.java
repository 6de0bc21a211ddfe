/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.walstream.annotation.Immutable;
import io.walstream.pipeline.Sizeable;

/**
 * A single change read from the replication slot: a row change or a transaction boundary, stamped with its
 * position in the write-ahead log.
 */
@Immutable
public final class ChangeEvent implements Sizeable {

    private final Operation operation;
    private final String table;
    private final List<ReplicationColumn> columns;
    private final Lsn position;
    private final Long transactionId;
    private final Instant commitTime;
    private final long size;

    ChangeEvent(Operation operation, String table, List<ReplicationColumn> columns, Lsn position, Long transactionId,
                Instant commitTime, long size) {
        this.operation = Objects.requireNonNull(operation);
        this.table = table;
        this.columns = Collections.unmodifiableList(columns);
        this.position = Objects.requireNonNull(position);
        this.transactionId = transactionId;
        this.commitTime = commitTime;
        this.size = size;
    }

    public Operation operation() {
        return operation;
    }

    /**
     * @return the schema-qualified name of the changed table, or null for {@link Operation#BEGIN} and {@link Operation#COMMIT}
     */
    public String table() {
        return table;
    }

    /**
     * @return the columns of the changed row in table order; empty for transaction boundaries
     */
    public List<ReplicationColumn> columns() {
        return columns;
    }

    /**
     * Get the column with the given name.
     *
     * @param name the column name
     * @return the column, or null if the row has no such column
     */
    public ReplicationColumn column(String name) {
        for (ReplicationColumn column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        return null;
    }

    public Lsn position() {
        return position;
    }

    /**
     * @return the id of the transaction the change belongs to, or null if the plugin did not send it
     */
    public Long transactionId() {
        return transactionId;
    }

    /**
     * @return the commit time of the transaction, or null if the plugin did not send it
     */
    public Instant commitTime() {
        return commitTime;
    }

    @Override
    public long objectSize() {
        return size;
    }

    @Override
    public String toString() {
        return "ChangeEvent [operation=" + operation + ", table=" + table + ", position=" + position.asString()
                + ", transactionId=" + transactionId + ", commitTime=" + commitTime + ", columns=" + columns + "]";
    }
}
