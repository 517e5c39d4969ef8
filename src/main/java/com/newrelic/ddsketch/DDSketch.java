// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch;

import com.newrelic.ddsketch.SketchException.ErrorKind;
import com.newrelic.ddsketch.mapping.IndexMapping;
import com.newrelic.ddsketch.mapping.LogarithmicMapping;
import com.newrelic.ddsketch.store.Bin;
import com.newrelic.ddsketch.store.CollapsingPolicy;
import com.newrelic.ddsketch.store.CollapsingStore;
import com.newrelic.ddsketch.store.SparseStore;
import com.newrelic.ddsketch.store.Store;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

// Quantile sketch with relative error guarantee.
//
// Positive values are counted in positiveValueStore, negative values in negativeValueStore by absolute value,
// both through the same index mapping. Values too close to zero to be indexed are counted by zeroCount.
// Count, sum, min and max are tracked exactly.
//
// For any quantile q in (0, 1), the reported value v' and the actual value v satisfy
//      abs(v - v') <= relativeAccuracy * abs(v)
// as long as v falls in a bin that has not been collapsed. Quantiles 0 and 1 return the exact min and max.
//
// This class is not thread safe. See SynchronizedDDSketch for a synchronized wrapper.

public class DDSketch {
    private static final Logger LOG = LoggerFactory.getLogger(DDSketch.class);

    public static final double DEFAULT_RELATIVE_ACCURACY = 0.01;
    public static final int DEFAULT_MAX_NUM_BINS = 2048; // Covers a max/min contrast of about 1e17 at 1% relative accuracy

    public static final int UNBOUNDED = 0; // getMaxNumBins() value of a sketch without bin limit

    private final IndexMapping mapping;
    private final Store positiveValueStore;
    private final Store negativeValueStore;
    private final int maxNumBins;
    @Nullable
    private final CollapsingPolicy collapsingPolicy; // null when unbounded

    private long count;
    private long zeroCount;
    private double sum = 0;
    private double min = Double.NaN;
    private double max = Double.NaN;

    public static DDSketch create() {
        return create(DEFAULT_RELATIVE_ACCURACY);
    }

    // Unbounded sketch. Memory grows with the number of distinct bins seen, which is logarithmic in
    // the max/min contrast of the input.
    public static DDSketch create(final double relativeAccuracy) {
        final IndexMapping mapping = new LogarithmicMapping(relativeAccuracy);
        return new DDSketch(mapping, new SparseStore(), new SparseStore(), UNBOUNDED, null);
    }

    public static DDSketch createBounded(final double relativeAccuracy) {
        return createBounded(relativeAccuracy, DEFAULT_MAX_NUM_BINS);
    }

    // Bounded sketch. Positive and negative stores each hold at most maxNumBins bins, collapsing lowest
    // magnitudes first.
    public static DDSketch createBounded(final double relativeAccuracy, final int maxNumBins) {
        return createBounded(relativeAccuracy, maxNumBins, CollapsingPolicy.DEFAULT);
    }

    public static DDSketch createBounded(final double relativeAccuracy,
                                         final int maxNumBins,
                                         final CollapsingPolicy collapsingPolicy) {
        final IndexMapping mapping = new LogarithmicMapping(relativeAccuracy); // Validates accuracy first
        if (maxNumBins <= 0) {
            throw new SketchException(ErrorKind.INVALID_BOUND, "maxNumBins " + maxNumBins + " must be positive");
        }
        if (collapsingPolicy == null) {
            throw new SketchException(ErrorKind.INVALID_BOUND, "Collapsing policy must not be null");
        }
        return new DDSketch(mapping,
                new CollapsingStore(maxNumBins, collapsingPolicy),
                new CollapsingStore(maxNumBins, collapsingPolicy),
                maxNumBins,
                collapsingPolicy);
    }

    private DDSketch(final IndexMapping mapping,
                     final Store positiveValueStore,
                     final Store negativeValueStore,
                     final int maxNumBins,
                     @Nullable final CollapsingPolicy collapsingPolicy) {
        this.mapping = mapping;
        this.positiveValueStore = positiveValueStore;
        this.negativeValueStore = negativeValueStore;
        this.maxNumBins = maxNumBins;
        this.collapsingPolicy = collapsingPolicy;
    }

    // Deep copy
    private DDSketch(final DDSketch source) {
        this(source.mapping,
                source.positiveValueStore.copy(),
                source.negativeValueStore.copy(),
                source.maxNumBins,
                source.collapsingPolicy);
        this.count = source.count;
        this.zeroCount = source.zeroCount;
        this.sum = source.sum;
        this.min = source.min;
        this.max = source.max;
    }

    public DDSketch copy() {
        return new DDSketch(this);
    }

    // Insert a single value.
    public void add(final double value) {
        add(value, 1);
    }

    // Insert a value with arbitrary count. Zero count is a no-op.
    public void add(final double value, final long count) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new SketchException(ErrorKind.INVALID_VALUE, "Cannot add non-finite value " + value);
        }
        if (count < 0) {
            throw new SketchException(ErrorKind.INVALID_VALUE, "Count " + count + " must not be negative");
        }
        if (count == 0) {
            return;
        }
        if (count > Long.MAX_VALUE - this.count) { // Store and zero counts never exceed this.count
            throw new SketchException(ErrorKind.INVALID_VALUE,
                    "Count " + count + " would overflow total count " + this.count);
        }

        final double magnitude = Math.abs(value);
        if (magnitude < mapping.getMinIndexableValue()) {
            zeroCount += count;
        } else if (value > 0) {
            positiveValueStore.add(mapping.getIndex(magnitude), count);
        } else {
            negativeValueStore.add(mapping.getIndex(magnitude), count);
        }

        this.count += count;
        sum += value * count;
        updateMin(value);
        updateMax(value);
    }

    private void updateMin(final double d) {
        if (Double.isNaN(min) || d < min) {
            min = d;
        }
    }

    private void updateMax(final double d) {
        if (Double.isNaN(max) || d > max) {
            max = d;
        }
    }

    // Merge "other" into "this". Does not modify "other".
    // Sketches must share the same relative accuracy and the same bin limit and collapsing policy.
    public void merge(final DDSketch other) {
        checkMergeable(other);

        if (other.count == 0) {
            return;
        }
        if (other.count > Long.MAX_VALUE - count) {
            throw new SketchException(ErrorKind.COUNT_OVERFLOW,
                    "Merging count " + other.count + " would overflow total count " + count);
        }

        // Merging with itself doubles every count. Snapshot first so that the counters below read the old values.
        final DDSketch source = other == this ? copy() : other;

        negativeValueStore.mergeWith(source.negativeValueStore);
        positiveValueStore.mergeWith(source.positiveValueStore);

        count += source.count;
        zeroCount += source.zeroCount;
        sum += source.sum;
        updateMin(source.min);
        updateMax(source.max);
    }

    private void checkMergeable(final DDSketch other) {
        if (!mapping.equals(other.mapping)) {
            LOG.debug("Rejected merge of {} into {}", other.mapping, mapping);
            throw new SketchException(ErrorKind.INCOMPATIBLE_SKETCHES,
                    "Cannot merge sketch with " + other.mapping + " into sketch with " + mapping);
        }
        if (maxNumBins != other.maxNumBins || collapsingPolicy != other.collapsingPolicy) {
            LOG.debug("Rejected merge of bound {}/{} into bound {}/{}", other.maxNumBins, other.collapsingPolicy, maxNumBins, collapsingPolicy);
            throw new SketchException(ErrorKind.INCOMPATIBLE_SKETCHES,
                    "Cannot merge sketch with maxNumBins=" + other.maxNumBins + ", policy=" + other.collapsingPolicy
                            + " into sketch with maxNumBins=" + maxNumBins + ", policy=" + collapsingPolicy);
        }
    }

    // Returns the value at quantile q, in [0, 1].
    //
    // Quantile q maps to rank q * (count - 1), counted from 0 over values sorted from low to high.
    // The rank is searched on negative bins from highest magnitude down, then zeros, then positive bins from
    // lowest magnitude up. The value of the first bin reaching past the rank is returned, clamped to [min, max].
    public double getQuantileValue(final double q) {
        checkQuantile(q);
        checkNotEmpty();
        return getCheckedQuantileValue(q);
    }

    // Returns values matching the quantiles array, in the same order. The input array is not modified.
    // All quantiles are validated before any is computed.
    public double[] getQuantileValues(final double[] quantiles) {
        for (final double q : quantiles) {
            checkQuantile(q);
        }
        checkNotEmpty();

        final double[] output = new double[quantiles.length];
        for (int i = 0; i < quantiles.length; i++) {
            output[i] = getCheckedQuantileValue(quantiles[i]);
        }
        return output;
    }

    private static void checkQuantile(final double q) {
        if (!(q >= 0 && q <= 1)) { // Negated so that NaN is rejected too
            throw new SketchException(ErrorKind.INVALID_QUANTILE, "Quantile " + q + " out of valid range of [0, 1]");
        }
    }

    private void checkNotEmpty() {
        if (count == 0) {
            throw new SketchException(ErrorKind.EMPTY_SKETCH, "Cannot compute quantile from empty sketch");
        }
    }

    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    private double getCheckedQuantileValue(final double q) {
        if (q == 0) {
            return min;
        }
        if (q == 1) {
            return max;
        }

        final double rank = q * (count - 1);
        long accumulativeCount = 0;

        final Iterator<Bin> negativeBins = negativeValueStore.descendingIterator();
        while (negativeBins.hasNext()) {
            final Bin bin = negativeBins.next();
            accumulativeCount += bin.getCount();
            if (accumulativeCount > rank) {
                return clamp(-mapping.getValue(bin.getIndex()));
            }
        }

        accumulativeCount += zeroCount;
        if (accumulativeCount > rank) {
            return clamp(0);
        }

        for (final Bin bin : positiveValueStore) {
            accumulativeCount += bin.getCount();
            if (accumulativeCount > rank) {
                return clamp(mapping.getValue(bin.getIndex()));
            }
        }

        throw new IllegalStateException("accumulativeCount " + accumulativeCount + " does not reach rank " + rank
                + " of totalCount " + count);
    }

    // A bin's value may lie beyond the extremes actually seen. Never report beyond them.
    private double clamp(final double value) {
        return Math.max(min, Math.min(max, value));
    }

    // Back to the empty state. Relative accuracy and bin limit are kept.
    public void clear() {
        positiveValueStore.clear();
        negativeValueStore.clear();
        count = 0;
        zeroCount = 0;
        sum = 0;
        min = Double.NaN;
        max = Double.NaN;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public long getCount() {
        return count;
    }

    public long getZeroCount() {
        return zeroCount;
    }

    // Returns sum of inserted values. Returns 0 if sketch is empty.
    public double getSum() {
        return sum;
    }

    // Returns min of inserted values. Returns NaN if sketch is empty.
    public double getMin() {
        return min;
    }

    // Returns max of inserted values. Returns NaN if sketch is empty.
    public double getMax() {
        return max;
    }

    public double getRelativeAccuracy() {
        return mapping.getRelativeAccuracy();
    }

    public IndexMapping getIndexMapping() {
        return mapping;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public Store getPositiveValueStore() {
        return positiveValueStore;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public Store getNegativeValueStore() {
        return negativeValueStore;
    }

    // Returns UNBOUNDED (0) when the sketch has no bin limit.
    public int getMaxNumBins() {
        return maxNumBins;
    }

    // Returns null when the sketch has no bin limit.
    @Nullable
    public CollapsingPolicy getCollapsingPolicy() {
        return collapsingPolicy;
    }

    private static boolean equalsWithNaN(final double a, final double b) {
        return a == b || Double.isNaN(a) && Double.isNaN(b); // Need this function because NaN does not equal anything.
    }

    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof DDSketch)) {
            return false;
        }
        final DDSketch other = (DDSketch) obj;
        return count == other.count
                && zeroCount == other.zeroCount
                && sum == other.sum
                && equalsWithNaN(min, other.min)
                && equalsWithNaN(max, other.max)
                && maxNumBins == other.maxNumBins
                && collapsingPolicy == other.collapsingPolicy
                && mapping.equals(other.mapping)
                && positiveValueStore.equals(other.positiveValueStore)
                && negativeValueStore.equals(other.negativeValueStore);
    }

    @Override
    public int hashCode() {
        int result = 1;
        result = 31 * result + Long.hashCode(count);
        result = 31 * result + Long.hashCode(zeroCount);
        result = 31 * result + Double.hashCode(sum);
        result = 31 * result + Double.hashCode(min);
        result = 31 * result + Double.hashCode(max);
        result = 31 * result + Integer.hashCode(maxNumBins);
        result = 31 * result + (collapsingPolicy == null ? -1 : collapsingPolicy.ordinal());
        result = 31 * result + mapping.hashCode();
        result = 31 * result + positiveValueStore.hashCode();
        result = 31 * result + negativeValueStore.hashCode();
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("count=" + count);
        builder.append(", sum=" + sum);
        builder.append(", min=" + min);
        builder.append(", max=" + max);
        builder.append(", mapping=" + mapping);
        builder.append(", maxNumBins=" + maxNumBins);
        builder.append(", zeroCount=" + zeroCount);
        builder.append(", positiveValueStore={" + positiveValueStore + "}");
        builder.append(", negativeValueStore={" + negativeValueStore + "}");
        return builder.toString();
    }
}
