// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

// A synchronized wrapper for DDSketch, for callers that share one sketch among threads.
// DDSketch itself does no locking. Writers that can each own a sketch should do so, and merge periodically.
// NOTES:
// 1. getSketch() exposes the unsynchronized sketch. Caller must use "synchronized" on this wrapper
//    around any access through it, including iteration on its stores.
// 2. merge() snapshots "other" under its own lock, then merges the snapshot under this lock.
//    The two locks are never held together, so cross merges between two wrappers cannot deadlock.
//
public class SynchronizedDDSketch {
    private final DDSketch sketch;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    public SynchronizedDDSketch(final DDSketch sketch) {
        this.sketch = sketch;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public DDSketch getSketch() {
        return sketch;
    }

    public synchronized void add(final double value) {
        sketch.add(value);
    }

    public synchronized void add(final double value, final long count) {
        sketch.add(value, count);
    }

    // Caller must ensure that "other" is protected from concurrent modification.
    public synchronized void merge(final DDSketch other) {
        sketch.merge(other);
    }

    public void merge(final SynchronizedDDSketch other) {
        final DDSketch snapshot = other.copySketch();
        synchronized (this) {
            sketch.merge(snapshot);
        }
    }

    // Returns an unsynchronized deep copy of the wrapped sketch.
    public synchronized DDSketch copySketch() {
        return sketch.copy();
    }

    public synchronized SynchronizedDDSketch copy() {
        return new SynchronizedDDSketch(sketch.copy());
    }

    public synchronized double getQuantileValue(final double q) {
        return sketch.getQuantileValue(q);
    }

    public synchronized double[] getQuantileValues(final double[] quantiles) {
        return sketch.getQuantileValues(quantiles);
    }

    public synchronized void clear() {
        sketch.clear();
    }

    public synchronized boolean isEmpty() {
        return sketch.isEmpty();
    }

    public synchronized long getCount() {
        return sketch.getCount();
    }

    public synchronized double getSum() {
        return sketch.getSum();
    }

    public synchronized double getMin() {
        return sketch.getMin();
    }

    public synchronized double getMax() {
        return sketch.getMax();
    }

    public double getRelativeAccuracy() {
        return sketch.getRelativeAccuracy(); // Immutable
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof SynchronizedDDSketch)) {
            return false;
        }
        return copySketch().equals(((SynchronizedDDSketch) obj).copySketch());
    }

    @Override
    public synchronized int hashCode() {
        return sketch.hashCode(); // Hash code collision between "this" and "this.sketch" is acceptable.
    }

    @Override
    public synchronized String toString() {
        return "SynchronizedDDSketch{" + sketch + "}";
    }
}
