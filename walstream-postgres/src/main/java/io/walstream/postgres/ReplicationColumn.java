/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.util.Arrays;
import java.util.Objects;

import io.walstream.annotation.Immutable;

/**
 * One column of a changed row as sent by the logical decoding plugin. The value is not interpreted: it is the
 * {@link Integer}, {@link Long}, {@link Float}, {@link Double}, {@link Boolean}, {@link String}, {@code byte[]} or
 * {@link Point} the plugin chose for the column type, or {@code null}.
 */
@Immutable
public final class ReplicationColumn {

    /**
     * A geometric point value.
     */
    @Immutable
    public static final class Point {
        private final double x;
        private final double y;

        public Point(double x, double y) {
            this.x = x;
            this.y = y;
        }

        public double x() {
            return x;
        }

        public double y() {
            return y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Point that = (Point) o;
            return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y);
        }

        @Override
        public String toString() {
            return "(" + x + "," + y + ")";
        }
    }

    private final String name;
    private final long typeOid;
    private final String typeModifier;
    private final boolean optional;
    private final Object value;
    private final Object oldValue;
    private final boolean hasOldValue;
    private final boolean unchangedToast;

    ReplicationColumn(String name, long typeOid, String typeModifier, boolean optional, Object value, Object oldValue,
                      boolean hasOldValue, boolean unchangedToast) {
        this.name = name;
        this.typeOid = typeOid;
        this.typeModifier = typeModifier;
        this.optional = optional;
        this.value = value;
        this.oldValue = oldValue;
        this.hasOldValue = hasOldValue;
        this.unchangedToast = unchangedToast;
    }

    public String name() {
        return name;
    }

    /**
     * @return the OID of the declared column type
     */
    public long typeOid() {
        return typeOid;
    }

    /**
     * @return the type with its modifiers, e.g. {@code character varying(255)}, or null if the plugin sent no type metadata
     */
    public String typeModifier() {
        return typeModifier;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * @return the value after the change; null for a deleted row, a SQL {@code NULL}, or an {@link #isUnchangedToast() unchanged TOAST} value.
     *         A {@code byte[]} value is a copy.
     */
    public Object value() {
        return copyOf(value);
    }

    public Object oldValue() {
        return copyOf(oldValue);
    }

    private static Object copyOf(Object value) {
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    /**
     * @return whether the plugin sent a value before the change, which depends on the replica identity of the table
     */
    public boolean hasOldValue() {
        return hasOldValue;
    }

    /**
     * @return whether the value was stored out of line and not changed, so the plugin did not send it
     */
    public boolean isUnchangedToast() {
        return unchangedToast;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReplicationColumn that = (ReplicationColumn) o;
        return typeOid == that.typeOid
                && optional == that.optional
                && hasOldValue == that.hasOldValue
                && unchangedToast == that.unchangedToast
                && name.equals(that.name)
                && Objects.equals(typeModifier, that.typeModifier)
                && Objects.deepEquals(value, that.value)
                && Objects.deepEquals(oldValue, that.oldValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeOid, typeModifier);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('=').append(render(value));
        if (hasOldValue) {
            sb.append(" (was ").append(render(oldValue)).append(')');
        }
        if (unchangedToast) {
            sb.append(" (unchanged toast)");
        }
        return sb.toString();
    }

    private static String render(Object value) {
        return value instanceof byte[] ? Arrays.toString((byte[]) value) : String.valueOf(value);
    }
}
