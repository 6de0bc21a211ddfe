/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.InvalidProtocolBufferException;

import io.walstream.annotation.NotThreadSafe;
import io.walstream.annotation.VisibleForTesting;
import io.walstream.postgres.proto.PgProto;

/**
 * Turns the byte stream written by the reader into {@link ChangeEvent}s.
 * <p>
 * The stream is a sequence of frames, each a 4-byte big-endian payload length followed by the payload. A payload
 * starts with the 8-byte big-endian log sequence number of the change, the rest is a decoderbufs
 * {@link PgProto.RowMessage}. Bytes may be {@link #feed(byte[], int, int) fed} in chunks of any size; {@link #next()}
 * hands out events as soon as their frame is complete.
 * <p>
 * Once a frame cannot be decoded the decoder is failed for good: the stream cannot be resynchronised, so every
 * subsequent call throws the same {@link DecodeException}.
 */
@NotThreadSafe
public class FrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrameDecoder.class);

    @VisibleForTesting
    static final int LENGTH_BYTES = Integer.BYTES;
    @VisibleForTesting
    static final int POSITION_BYTES = Long.BYTES;
    private static final int INITIAL_CAPACITY = 8192;
    /**
     * Largest array the JVM reliably allocates.
     */
    private static final int MAX_BUFFER_BYTES = Integer.MAX_VALUE - 8;
    /**
     * Largest payload length a decoder can be configured with, so that a whole frame fits one buffer.
     */
    public static final int MAX_PAYLOAD_BYTES = MAX_BUFFER_BYTES - LENGTH_BYTES;

    private final int maxFrameBytes;
    private ByteBuffer buffer;
    private DecodeException failure;

    /**
     * @param maxFrameBytes the largest acceptable payload length
     */
    public FrameDecoder(int maxFrameBytes) {
        if (maxFrameBytes < POSITION_BYTES || maxFrameBytes > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Maximum frame size must be between " + POSITION_BYTES + " and " + MAX_PAYLOAD_BYTES
                    + " but was " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
        this.buffer = ByteBuffer.allocate((int) Math.min(INITIAL_CAPACITY, (long) LENGTH_BYTES + maxFrameBytes));
    }

    /**
     * Append bytes read from the reader.
     *
     * @param bytes the source array
     * @param offset the index of the first byte to append
     * @param length the number of bytes to append
     * @throws DecodeException if the decoder already failed, or the bytes would overflow the buffer
     */
    public void feed(byte[] bytes, int offset, int length) {
        throwIfFailed();
        ensureCapacity(length);
        buffer.put(bytes, offset, length);
    }

    /**
     * Decode the next buffered frame.
     *
     * @return the event of the next complete frame, or null if more bytes are needed
     * @throws DecodeException if the next frame is malformed, or the decoder already failed
     */
    public ChangeEvent next() {
        throwIfFailed();
        if (buffer.position() < LENGTH_BYTES) {
            return null;
        }
        final int payloadLength = buffer.getInt(0);
        if (payloadLength < POSITION_BYTES || payloadLength > maxFrameBytes) {
            throw fail(new DecodeException("Invalid frame length " + payloadLength + ", expected between "
                    + POSITION_BYTES + " and " + maxFrameBytes + " bytes"));
        }
        final int frameLength = LENGTH_BYTES + payloadLength;
        if (buffer.position() < frameLength) {
            return null;
        }

        final Lsn position = Lsn.valueOf(buffer.getLong(LENGTH_BYTES));
        final ByteBuffer message = buffer.duplicate();
        message.position(LENGTH_BYTES + POSITION_BYTES).limit(frameLength);
        final PgProto.RowMessage row;
        try {
            row = PgProto.RowMessage.parseFrom(message.slice());
        }
        catch (InvalidProtocolBufferException e) {
            throw fail(new DecodeException("Frame at " + position.asString() + " is not a valid row message", e));
        }

        final ChangeEvent event = toEvent(row, position, payloadLength);
        buffer.flip();
        buffer.position(frameLength);
        buffer.compact();
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Decoded frame of {} bytes: {}", payloadLength, event);
        }
        return event;
    }

    /**
     * @return the number of received bytes that do not form a complete frame yet
     */
    public int bufferedBytes() {
        return buffer.position();
    }

    /**
     * @return whether a malformed frame has been encountered
     */
    public boolean isFailed() {
        return failure != null;
    }

    private ChangeEvent toEvent(PgProto.RowMessage row, Lsn position, int payloadLength) {
        final Operation operation = operation(row, position);
        final Long transactionId = row.hasTransactionId() ? Integer.toUnsignedLong(row.getTransactionId()) : null;
        final Instant commitTime = row.hasCommitTime() ? Instant.EPOCH.plus(row.getCommitTime(), ChronoUnit.MICROS) : null;
        if (!operation.isDataChange()) {
            return new ChangeEvent(operation, null, Collections.emptyList(), position, transactionId, commitTime, payloadLength);
        }
        if (!row.hasTable()) {
            throw fail(new DecodeException(operation + " at " + position.asString() + " carries no table name"));
        }
        return new ChangeEvent(operation, row.getTable(), columns(operation, row), position, transactionId, commitTime, payloadLength);
    }

    private Operation operation(PgProto.RowMessage row, Lsn position) {
        switch (row.getOp()) {
            case INSERT:
                return Operation.INSERT;
            case UPDATE:
                return Operation.UPDATE;
            case DELETE:
                return Operation.DELETE;
            case BEGIN:
                return Operation.BEGIN;
            case COMMIT:
                return Operation.COMMIT;
            default:
                throw fail(new DecodeException("Unknown operation " + row.getOp() + " at " + position.asString()));
        }
    }

    private List<ReplicationColumn> columns(Operation operation, PgProto.RowMessage row) {
        if (operation == Operation.DELETE) {
            final List<ReplicationColumn> columns = new ArrayList<>(row.getOldTupleCount());
            for (PgProto.DatumMessage datum : row.getOldTupleList()) {
                columns.add(new ReplicationColumn(datum.getColumnName(), datum.getColumnType(), null, true,
                        null, valueOf(datum), true, datum.hasDatumMissing()));
            }
            return columns;
        }

        final Map<String, PgProto.DatumMessage> oldValues = new HashMap<>();
        for (PgProto.DatumMessage datum : row.getOldTupleList()) {
            oldValues.put(datum.getColumnName(), datum);
        }
        final List<ReplicationColumn> columns = new ArrayList<>(row.getNewTupleCount());
        for (int i = 0; i < row.getNewTupleCount(); i++) {
            final PgProto.DatumMessage datum = row.getNewTuple(i);
            final PgProto.TypeInfo typeInfo = i < row.getNewTypeinfoCount() ? row.getNewTypeinfo(i) : null;
            final PgProto.DatumMessage old = oldValues.get(datum.getColumnName());
            columns.add(new ReplicationColumn(datum.getColumnName(), datum.getColumnType(),
                    typeInfo != null ? typeInfo.getModifier() : null,
                    typeInfo == null || typeInfo.getValueOptional(),
                    valueOf(datum), old != null ? valueOf(old) : null, old != null, datum.hasDatumMissing()));
        }
        return columns;
    }

    private static Object valueOf(PgProto.DatumMessage datum) {
        switch (datum.getDatumCase()) {
            case DATUM_INT32:
                return datum.getDatumInt32();
            case DATUM_INT64:
                return datum.getDatumInt64();
            case DATUM_FLOAT:
                return datum.getDatumFloat();
            case DATUM_DOUBLE:
                return datum.getDatumDouble();
            case DATUM_BOOL:
                return datum.getDatumBool();
            case DATUM_STRING:
                return datum.getDatumString();
            case DATUM_BYTES:
                return datum.getDatumBytes().toByteArray();
            case DATUM_POINT:
                return new ReplicationColumn.Point(datum.getDatumPoint().getX(), datum.getDatumPoint().getY());
            default:
                // SQL NULL or unchanged TOAST value
                return null;
        }
    }

    private void ensureCapacity(int length) {
        if (buffer.remaining() >= length) {
            return;
        }
        final long required = (long) buffer.position() + length;
        if (required > MAX_BUFFER_BYTES) {
            throw fail(new DecodeException("Reader output of " + required + " bytes without a complete frame exceeds the buffer limit"));
        }
        final int capacity = (int) Math.min(MAX_BUFFER_BYTES, Math.max(required, buffer.capacity() * 2L));
        final ByteBuffer grown = ByteBuffer.allocate(capacity);
        buffer.flip();
        grown.put(buffer);
        buffer = grown;
    }

    private DecodeException fail(DecodeException e) {
        failure = e;
        return e;
    }

    private void throwIfFailed() {
        if (failure != null) {
            throw failure;
        }
    }
}
