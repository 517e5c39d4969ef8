// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.mapping;

import com.newrelic.ddsketch.SketchException;
import com.newrelic.ddsketch.SketchException.ErrorKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

// Use Math.log(). Bucket i holds magnitudes in (gamma^(i-1), gamma^i], where
//      gamma = (1 + relativeAccuracy) / (1 - relativeAccuracy)
//
// Representative value of bucket i is gamma^i * (1 - relativeAccuracy), which equals gamma^(i-1) * (1 + relativeAccuracy).
// So it is off by exactly relativeAccuracy at both bucket bounds, and by less inside the bucket.
//
// Rounding in Math.log() may move a magnitude that sits within a few ulps of a bound into the neighboring bucket.
// The neighbor's representative value is then off by relativeAccuracy plus those few ulps, never more.

public class LogarithmicMapping implements IndexMapping {
    // |ln(Double.MIN_VALUE)|, the largest |ln(magnitude)| this mapping may see.
    static final double MAX_ABS_LOG = -Math.log(Double.MIN_VALUE);

    // Indices are computed in double. Beyond 2^53, they are no longer exact integers.
    static final double MAX_EXACT_INDEX = 0x1p53;

    private final double relativeAccuracy;
    private final double gamma;
    private final double logGamma;

    // index = log(value) / log(gamma) = log(value) * multiplier
    // Because multiplication is faster than division, we define multiplier as 1 / log(gamma).
    private final double multiplier;

    // log(1 - relativeAccuracy). Offset from a bucket's upper bound to its representative value, in log space.
    private final double logValueOffset;

    private final double minIndexableValue;

    public LogarithmicMapping(final double relativeAccuracy) {
        if (!(relativeAccuracy > 0 && relativeAccuracy < 1)) { // Negated so that NaN is rejected too
            throw new SketchException(ErrorKind.INVALID_ACCURACY,
                    "Relative accuracy " + relativeAccuracy + " out of valid range of (0, 1)");
        }
        this.relativeAccuracy = relativeAccuracy;

        // gamma - 1 = 2 * a / (1 - a). Use log1p() on it so that log(gamma) keeps its precision when "a" is tiny.
        final double gammaMinusOne = 2 * relativeAccuracy / (1 - relativeAccuracy);
        this.gamma = 1 + gammaMinusOne;
        this.logGamma = Math.log1p(gammaMinusOne);
        this.multiplier = 1 / logGamma;

        if (!(MAX_ABS_LOG * multiplier < MAX_EXACT_INDEX)) {
            throw new SketchException(ErrorKind.INVALID_ACCURACY,
                    "Relative accuracy " + relativeAccuracy + " too small to index the full range of double");
        }

        this.logValueOffset = Math.log1p(-relativeAccuracy);

        // Keep the lowest bucket's lower bound a normal double.
        this.minIndexableValue = Double.MIN_NORMAL * gamma;
    }

    @Override
    public long getIndex(final double magnitude) {
        // Use ceil() so that a bucket includes its upper bound. Plain "(long)" rounds toward 0.
        return (long) Math.ceil(Math.log(magnitude) * multiplier);
    }

    @Override
    public double getValue(final long index) {
        // Top bucket's representative may exceed the range of double.
        return Math.min(Math.exp(index * logGamma + logValueOffset), Double.MAX_VALUE);
    }

    @Override
    public double getLowerBound(final long index) {
        return Math.exp((index - 1) * logGamma);
    }

    @Override
    public double getUpperBound(final long index) {
        return Math.min(Math.exp(index * logGamma), Double.MAX_VALUE);
    }

    @Override
    public double getRelativeAccuracy() {
        return relativeAccuracy;
    }

    @Override
    public double getGamma() {
        return gamma;
    }

    @Override
    public double getMinIndexableValue() {
        return minIndexableValue;
    }

    // relativeAccuracy determines every other field. Comparing gamma is not enough: gamma is rounded,
    // while logGamma comes from log1p() and keeps bits that distinguish nearby accuracies.
    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return relativeAccuracy == ((LogarithmicMapping) obj).relativeAccuracy;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(relativeAccuracy);
    }

    @Override
    public String toString() {
        return "LogarithmicMapping{relativeAccuracy=" + relativeAccuracy + ", gamma=" + gamma + "}";
    }
}
