// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.store;

import java.util.Iterator;

// Counts values per bucket index.
// - Only indices with a positive count are held. Adding a zero count is a no-op.
// - iterator() returns bins sorted by index from low to high. Each call starts a new pass.
// - Iterators are not fail-safe. Do not modify the store while iterating it.
public interface Store extends Iterable<Bin> {

    // Increment the bin at "index" by 1.
    default void add(final long index) {
        add(index, 1);
    }

    // Increment the bin at "index" by "count", creating the bin if absent.
    // Throws IllegalArgumentException when count is negative.
    void add(final long index, final long count);

    default void add(final Bin bin) {
        add(bin.getIndex(), bin.getCount());
    }

    // Add all bins of "other" into "this". An implementation should not modify "other".
    void mergeWith(final Store other);

    // Returns count at "index", or 0 when the bin is absent.
    long get(final long index);

    // Returns total count across all bins
    long getTotalCount();

    // Returns number of bins held.
    int getNumBins();

    default boolean isEmpty() {
        return getNumBins() == 0;
    }

    // Lowest index held. Throws NoSuchElementException when empty.
    long getMinIndex();

    // Highest index held. Throws NoSuchElementException when empty.
    long getMaxIndex();

    // Bins sorted by index from high to low.
    Iterator<Bin> descendingIterator();

    // Returns a deep copy of the store, with the same bound if any.
    Store copy();

    void clear();
}
