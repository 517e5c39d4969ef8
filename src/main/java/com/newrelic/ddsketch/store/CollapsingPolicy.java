// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch.store;

import java.util.Map;
import java.util.NavigableMap;

// Which end of the index range a bounded store gives up when it runs out of bins.
// Indices grow with magnitude, so the policy picks the magnitudes that keep full resolution.
// The bins on the collapsing end are folded into the innermost surviving bin, whose representative
// value then stands for all of them.

public enum CollapsingPolicy {
    // Fold lowest indices up. Smallest magnitudes lose resolution, and high percentiles stay within
    // the relative accuracy.
    COLLAPSE_LOWEST {
        @Override
        Map.Entry<Long, Long> pollOutermost(final NavigableMap<Long, Long> bins) {
            return bins.pollFirstEntry();
        }

        @Override
        long getOutermostIndex(final NavigableMap<Long, Long> bins) {
            return bins.firstKey();
        }
    },
    // Fold highest indices down. Largest magnitudes lose resolution, and low percentiles stay within
    // the relative accuracy.
    COLLAPSE_HIGHEST {
        @Override
        Map.Entry<Long, Long> pollOutermost(final NavigableMap<Long, Long> bins) {
            return bins.pollLastEntry();
        }

        @Override
        long getOutermostIndex(final NavigableMap<Long, Long> bins) {
            return bins.lastKey();
        }
    };

    public static final CollapsingPolicy DEFAULT = COLLAPSE_LOWEST;

    // Remove and return the bin on the collapsing end. Precondition: bins not empty.
    abstract Map.Entry<Long, Long> pollOutermost(final NavigableMap<Long, Long> bins);

    // Index of the bin on the collapsing end. Precondition: bins not empty.
    abstract long getOutermostIndex(final NavigableMap<Long, Long> bins);
}
