// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.store;

// A bucket index and the number of values counted in it.
public final class Bin {
    private final long index;
    private final long count;

    public Bin(final long index, final long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Bin count " + count + " must not be negative");
        }
        this.index = index;
        this.count = count;
    }

    public long getIndex() {
        return index;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof Bin)) {
            return false;
        }
        final Bin other = (Bin) obj;
        return index == other.index && count == other.count;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(index);
        result = 31 * result + Long.hashCode(count);
        return result;
    }

    @Override
    public String toString() {
        return "{index=" + index + ", count=" + count + "}";
    }
}
