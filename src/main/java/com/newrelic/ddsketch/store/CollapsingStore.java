// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

// Store bounded to maxNumBins bins. When a change leaves more bins than that, bins on the
// policy's end are folded into the innermost surviving one until maxNumBins bins remain.
// Total count is unchanged by collapsing.
//
// The result depends only on the indices and counts added, not on the order they arrived in, nor on
// whether they arrived through add() or mergeWith(). The boundary bin only moves toward the kept end:
// once an index is folded, any later value at or beyond it on the collapsing end lands in the boundary bin.

public class CollapsingStore extends SparseStore {
    private static final Logger LOG = LoggerFactory.getLogger(CollapsingStore.class);

    private final int maxNumBins;
    private final CollapsingPolicy policy;

    public CollapsingStore(final int maxNumBins) {
        this(maxNumBins, CollapsingPolicy.DEFAULT);
    }

    public CollapsingStore(final int maxNumBins, final CollapsingPolicy policy) {
        if (maxNumBins <= 0) {
            throw new IllegalArgumentException("maxNumBins " + maxNumBins + " must be positive");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Collapsing policy must not be null");
        }
        this.maxNumBins = maxNumBins;
        this.policy = policy;
    }

    // Deep copy
    protected CollapsingStore(final CollapsingStore source) {
        super(source);
        this.maxNumBins = source.maxNumBins;
        this.policy = source.policy;
    }

    @Override
    protected void collapseIfNeeded() {
        final int excess = bins.size() - maxNumBins;
        if (excess <= 0) {
            return;
        }

        long collapsedCount = 0;
        for (int i = 0; i < excess; i++) {
            final Map.Entry<Long, Long> outermost = policy.pollOutermost(bins);
            collapsedCount += outermost.getValue();
        }

        final long boundaryIndex = policy.getOutermostIndex(bins);
        bins.merge(boundaryIndex, collapsedCount, Long::sum);

        LOG.debug("Collapsed {} bins with count {} into index {} ({})", excess, collapsedCount, boundaryIndex, policy);

        if (bins.size() > maxNumBins) {
            throw new IllegalStateException("CollapsingStore: " + bins.size() + " bins exceed maxNumBins " + maxNumBins + " after collapse");
        }
    }

    public int getMaxNumBins() {
        return maxNumBins;
    }

    public CollapsingPolicy getCollapsingPolicy() {
        return policy;
    }

    @Override
    public Store copy() {
        return new CollapsingStore(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        final CollapsingStore other = (CollapsingStore) obj;
        return maxNumBins == other.maxNumBins && policy == other.policy;
    }

    @Override
    public int hashCode() {
        int result = super.hashCode();
        result = 31 * result + Integer.hashCode(maxNumBins);
        result = 31 * result + policy.ordinal();
        return result;
    }

    @Override
    public String toString() {
        return "maxNumBins=" + maxNumBins + ", policy=" + policy + ", " + super.toString();
    }
}
