// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.mapping;

// Maps a positive magnitude to a bucket index, and a bucket index back to a representative value.
// Bucket i covers magnitudes in (lowerBound(i), upperBound(i)], where upperBound(i) = gamma * lowerBound(i).
// Sign is not handled here. Callers route negative values by absolute value, and values below
// getMinIndexableValue() to a separate zero counter.
//
// Two mappings can share bins (ie. their sketches can merge) only if they are equal().
// Implementations must define equals() and hashCode() on the parameters that determine the index layout.

public interface IndexMapping {
    // Map a magnitude to a bucket. Input must be in [getMinIndexableValue(), Double.MAX_VALUE].
    // Returned index may be negative. Monotonic non-decreasing in magnitude.
    long getIndex(final double magnitude);

    // Returns the value reported for any magnitude in the bucket.
    // Its relative error to every magnitude in the bucket is at most getRelativeAccuracy().
    double getValue(final long index);

    // Returns a bucket's exclusive start bound.
    double getLowerBound(final long index);

    // Returns a bucket's inclusive end bound.
    double getUpperBound(final long index);

    double getRelativeAccuracy();

    // Ratio between upper and lower bounds of a bucket. Always greater than 1.
    double getGamma();

    // Magnitudes below this value cannot be indexed and are treated as zero.
    double getMinIndexableValue();
}
