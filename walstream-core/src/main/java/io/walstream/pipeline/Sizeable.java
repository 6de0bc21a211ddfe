/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.pipeline;

/**
 * An element whose approximate memory footprint is known, used to bound a {@link ChangeEventQueue} by size in bytes.
 */
public interface Sizeable {

    long objectSize();
}
