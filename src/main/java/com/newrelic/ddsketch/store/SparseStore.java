// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.store;

import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

// Unbounded store. Bins are kept in a sorted map keyed by index, so that memory is proportional to
// the number of distinct indices actually seen, not to the index range between them.

public class SparseStore implements Store {
    protected final NavigableMap<Long, Long> bins;
    private long totalCount;

    public SparseStore() {
        bins = new TreeMap<>();
    }

    // Deep copy
    protected SparseStore(final SparseStore source) {
        bins = new TreeMap<>(source.bins);
        totalCount = source.totalCount;
    }

    @Override
    public void add(final long index, final long count) {
        if (increment(index, count)) {
            collapseIfNeeded();
        }
    }

    // Merge all bins first, then collapse once, so that no bin of "other" is collapsed before its
    // neighbors from "other" have arrived.
    @Override
    public void mergeWith(final Store other) {
        // Merging with itself doubles every count. Snapshot first to avoid reading bins while writing them.
        final Store source = other == this ? copy() : other;
        checkTotalCount(source.getTotalCount()); // Bin counts never exceed totalCount, so one check covers them all
        boolean changed = false;
        for (final Bin bin : source) {
            changed |= increment(bin.getIndex(), bin.getCount());
        }
        if (changed) {
            collapseIfNeeded();
        }
    }

    // Returns true if the store changed.
    private boolean increment(final long index, final long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count " + count + " must not be negative");
        }
        if (count == 0) {
            return false;
        }
        checkTotalCount(count);
        bins.merge(index, count, Long::sum);
        totalCount += count;
        return true;
    }

    private void checkTotalCount(final long count) {
        if (count > Long.MAX_VALUE - totalCount) {
            throw new IllegalArgumentException("Count " + count + " would overflow total count " + totalCount);
        }
    }

    // Called after every change to the bins. Unbounded store never collapses.
    protected void collapseIfNeeded() {
    }

    @Override
    public long get(final long index) {
        return bins.getOrDefault(index, 0L);
    }

    @Override
    public long getTotalCount() {
        return totalCount;
    }

    @Override
    public int getNumBins() {
        return bins.size();
    }

    @Override
    public long getMinIndex() {
        return bins.firstKey();
    }

    @Override
    public long getMaxIndex() {
        return bins.lastKey();
    }

    @NotNull
    @Override
    public Iterator<Bin> iterator() {
        return new BinIterator(bins.entrySet().iterator());
    }

    @Override
    public Iterator<Bin> descendingIterator() {
        return new BinIterator(bins.descendingMap().entrySet().iterator());
    }

    @Override
    public Store copy() {
        return new SparseStore(this);
    }

    @Override
    public void clear() {
        bins.clear();
        totalCount = 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return bins.equals(((SparseStore) obj).bins); // totalCount is derived from bins
    }

    @Override
    public int hashCode() {
        return bins.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("totalCount=" + totalCount);
        builder.append(", numBins=" + bins.size());
        builder.append(", bins={");
        boolean first = true;
        for (final Map.Entry<Long, Long> entry : bins.entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            builder.append(entry.getKey()).append(':').append(entry.getValue());
            first = false;
        }
        builder.append("}");
        return builder.toString();
    }

    // Wraps a map entry iterator. A new Bin is returned on each call, so callers may keep them.
    private static class BinIterator implements Iterator<Bin> {
        private final Iterator<Map.Entry<Long, Long>> entries;

        BinIterator(final Iterator<Map.Entry<Long, Long>> entries) {
            this.entries = entries;
        }

        @Override
        public boolean hasNext() {
            return entries.hasNext();
        }

        @Override
        public Bin next() {
            final Map.Entry<Long, Long> entry = entries.next(); // Throws NoSuchElementException at the end
            return new Bin(entry.getKey(), entry.getValue());
        }
    }
}
