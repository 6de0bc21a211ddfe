/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.util.Objects;

import io.walstream.annotation.Immutable;
import io.walstream.util.Strings;

/**
 * A position in the PostgreSQL write-ahead log. The value is an unsigned 64-bit number kept in a {@code long};
 * positions are ordered by unsigned comparison.
 * <p>
 * The text form is the one PostgreSQL itself prints, two hexadecimal numbers separated by a slash,
 * e.g. {@code 16/B374D848}. The lower half is always rendered with eight digits.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    private static final long HALF_MASK = 0xFFFFFFFFL;
    private static final int MAX_HALF_DIGITS = 16;

    /**
     * Zero is used to indicate an invalid pointer. Bootstrap skips the first possible WAL segment,
     * initializing the first WAL page at XLOG_SEG_SIZE, so no XLOG record can begin at zero.
     */
    public static final Lsn INVALID = valueOf(0);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric position in the write-ahead log stream, interpreted as unsigned
     * @return the position; never null
     */
    public static Lsn valueOf(long value) {
        return new Lsn(value);
    }

    /**
     * Parse the textual form of a position.
     *
     * @param text two hexadecimal numbers of up to 8 significant digits each, separated by a slash,
     *            e.g. {@code 16/3002D50} or {@code 0/15d68c50}
     * @return the position; never null
     * @throws LsnFormatException if the text is not a well-formed position
     */
    public static Lsn valueOf(String text) {
        if (text == null) {
            throw new LsnFormatException("Log sequence number must not be null");
        }
        final int slash = text.indexOf('/');
        if (slash < 0 || slash != text.lastIndexOf('/')) {
            throw new LsnFormatException("Log sequence number '" + text + "' must contain exactly one '/'");
        }
        final long high = parseHalf(text, text.substring(0, slash));
        final long low = parseHalf(text, text.substring(slash + 1));
        return new Lsn((high << 32) | low);
    }

    private static long parseHalf(String text, String half) {
        if (!Strings.isHexadecimal(half) || half.length() > MAX_HALF_DIGITS) {
            throw new LsnFormatException("Log sequence number '" + text + "' is not two hexadecimal numbers separated by '/'");
        }
        final long value = Long.parseUnsignedLong(half, 16);
        if (Long.compareUnsigned(value, HALF_MASK) > 0) {
            throw new LsnFormatException("Log sequence number '" + text + "' has a part exceeding 32 bits");
        }
        return value;
    }

    /**
     * @return the position as a number, to be interpreted as unsigned
     */
    public long asLong() {
        return value;
    }

    /**
     * @return the position as {@code HIGH/LOW} in uppercase hexadecimal, e.g. {@code A1/243C4C60}
     */
    public String asString() {
        return Long.toHexString(value >>> 32).toUpperCase() + "/" + String.format("%08X", value & HALF_MASK);
    }

    /**
     * @return whether this is not {@link #INVALID}
     */
    public boolean isValid() {
        return this.value != INVALID.value;
    }

    /**
     * Determines whether this position lies within the given bounds, both inclusive.
     */
    public boolean isBetween(Lsn from, Lsn to) {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
        return compareTo(from) >= 0 && compareTo(to) <= 0;
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }
}
