// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch;

import com.newrelic.ddsketch.store.CollapsingPolicy;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static com.newrelic.ddsketch.DDSketchTest.assertRelativeError;
import static com.newrelic.ddsketch.DDSketchTest.exactQuantile;
import static com.newrelic.ddsketch.DDSketchTest.insertData;
import static com.newrelic.ddsketch.DDSketchTest.range;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

// Checks reported quantiles against exact quantiles of the same input.
@RunWith(Parameterized.class)
public class DDSketchAccuracyTest {
    private static final double FUDGE = 1 + 1e-12; // For values on or near a bin bound.
    private static final int TEST_MAX_NUM_BINS = 50;

    @Parameterized.Parameters(name = "relativeAccuracy {0}")
    public static Collection<Object[]> data() {
        final Collection<Object[]> collection = new ArrayList<>();
        for (final double accuracy : new double[]{0.001, 0.01, 0.02, 0.05, 0.1}) {
            collection.add(new Object[]{accuracy});
        }
        return collection;
    }

    @Parameterized.Parameter()
    public double relativeAccuracy;

    private static final double[] TEST_QUANTILES = testQuantiles();

    private static double[] testQuantiles() {
        final double[] quantiles = new double[203];
        for (int i = 0; i <= 200; i++) {
            quantiles[i] = i / 200.0;
        }
        quantiles[201] = 0.0001;
        quantiles[202] = 0.9999;
        return quantiles;
    }

    // Named input sets. Seeded, so that every run sees the same numbers.
    public static Map<String, double[]> datasets() {
        final Map<String, double[]> map = new LinkedHashMap<>();
        final Random random = new Random(42);

        map.put("uniform", range(1, 1000));

        final double[] lognormal = new double[10000];
        for (int i = 0; i < lognormal.length; i++) {
            lognormal[i] = Math.exp(random.nextGaussian() * 5);
        }
        map.put("lognormal", lognormal);

        final double[] wide = new double[5000];
        for (int i = 0; i < wide.length; i++) {
            wide[i] = Math.exp(random.nextDouble() * 1400 - 700);
        }
        map.put("wide", wide);

        final double[] mixed = new double[10000];
        for (int i = 0; i < mixed.length; i++) {
            mixed[i] = i % 20 == 0 ? 0 : (random.nextBoolean() ? 1 : -1) * Math.exp(random.nextGaussian() * 3);
        }
        map.put("mixed", mixed);

        final double[] negative = new double[3000];
        for (int i = 0; i < negative.length; i++) {
            negative[i] = -Math.exp(random.nextGaussian() * 2);
        }
        map.put("negative", negative);

        final double[] constant = new double[100];
        Arrays.fill(constant, 42);
        map.put("constant", constant);

        return map;
    }

    private void verifyQuantiles(final String name, final DDSketch sketch, final double[] values) {
        final double[] sorted = values.clone();
        Arrays.sort(sorted);

        assertEquals(name, sorted.length, sketch.getCount());
        assertEquals(name, sorted[0], sketch.getMin(), 0);
        assertEquals(name, sorted[sorted.length - 1], sketch.getMax(), 0);
        assertEquals(name, sorted[0], sketch.getQuantileValue(0), 0);
        assertEquals(name, sorted[sorted.length - 1], sketch.getQuantileValue(1), 0);

        for (final double q : TEST_QUANTILES) {
            assertRelativeError(exactQuantile(sorted, q), sketch.getQuantileValue(q), relativeAccuracy);
        }
    }

    @Test
    public void testUnbounded() {
        for (final Map.Entry<String, double[]> entry : datasets().entrySet()) {
            final DDSketch sketch = insertData(DDSketch.create(relativeAccuracy), entry.getValue());
            verifyQuantiles(entry.getKey(), sketch, entry.getValue());
        }
    }

    // A generous bound never collapses, so the bounded sketch is as accurate as the unbounded one.
    @Test
    public void testBoundedWithoutCollapse() {
        for (final Map.Entry<String, double[]> entry : datasets().entrySet()) {
            final DDSketch unbounded = insertData(DDSketch.create(relativeAccuracy), entry.getValue());
            final DDSketch bounded = insertData(DDSketch.createBounded(relativeAccuracy, 1_000_000), entry.getValue());

            verifyQuantiles(entry.getKey(), bounded, entry.getValue());
            assertEquals(unbounded.getPositiveValueStore().getTotalCount(), bounded.getPositiveValueStore().getTotalCount());
            assertEquals(unbounded.getPositiveValueStore().getNumBins(), bounded.getPositiveValueStore().getNumBins());
            assertEquals(unbounded.getNegativeValueStore().getNumBins(), bounded.getNegativeValueStore().getNumBins());
        }
    }

    // Merging any partition of the input gives the same bins and quantiles as one sketch over all of it.
    @Test
    public void testMergePartitions() {
        for (final Map.Entry<String, double[]> entry : datasets().entrySet()) {
            final double[] values = entry.getValue();
            for (final boolean bounded : new boolean[]{false, true}) {
                final DDSketch single = newSketch(bounded);
                insertData(single, values);

                final DDSketch[] parts = new DDSketch[4];
                for (int p = 0; p < parts.length; p++) {
                    parts[p] = newSketch(bounded);
                }
                for (int i = 0; i < values.length; i++) {
                    parts[i % parts.length].add(values[i]);
                }

                final DDSketch merged = newSketch(bounded);
                for (final DDSketch part : parts) {
                    merged.merge(part);
                }

                assertEquals(entry.getKey(), single.getCount(), merged.getCount());
                assertEquals(entry.getKey(), single.getZeroCount(), merged.getZeroCount());
                assertEquals(entry.getKey(), single.getMin(), merged.getMin(), 0);
                assertEquals(entry.getKey(), single.getMax(), merged.getMax(), 0);
                assertEquals(entry.getKey(), single.getPositiveValueStore(), merged.getPositiveValueStore());
                assertEquals(entry.getKey(), single.getNegativeValueStore(), merged.getNegativeValueStore());
                for (final double q : TEST_QUANTILES) {
                    assertEquals(entry.getKey(), single.getQuantileValue(q), merged.getQuantileValue(q), 0);
                }
                if (!bounded) {
                    verifyQuantiles(entry.getKey(), merged, values);
                }
            }
        }
    }

    private DDSketch newSketch(final boolean bounded) {
        return bounded ? DDSketch.createBounded(relativeAccuracy, TEST_MAX_NUM_BINS) : DDSketch.create(relativeAccuracy);
    }

    // Lowest bins collapse first, so quantiles at or above the lowest surviving bin keep the guarantee.
    // Quantiles below it are only overestimated.
    @Test
    public void testCollapseLowestKeepsHighQuantiles() {
        final double[] values = datasets().get("lognormal");
        final DDSketch sketch = insertData(
                DDSketch.createBounded(relativeAccuracy, TEST_MAX_NUM_BINS, CollapsingPolicy.COLLAPSE_LOWEST), values);
        final double[] sorted = values.clone();
        Arrays.sort(sorted);

        assertEquals(TEST_MAX_NUM_BINS, sketch.getPositiveValueStore().getNumBins());
        assertEquals(values.length, sketch.getPositiveValueStore().getTotalCount());

        final long boundary = sketch.getPositiveValueStore().getMinIndex();
        int accurate = 0;
        for (final double q : TEST_QUANTILES) {
            final double expected = exactQuantile(sorted, q);
            final double actual = sketch.getQuantileValue(q);
            if (sketch.getIndexMapping().getIndex(expected) >= boundary) {
                assertRelativeError(expected, actual, relativeAccuracy);
                accurate++;
            } else {
                assertTrue("expected " + expected + " actual " + actual, actual * FUDGE >= expected);
            }
        }
        assertRelativeError(sorted[(int) Math.floor(0.9999 * (sorted.length - 1))], sketch.getQuantileValue(0.9999), relativeAccuracy);
        assertTrue(accurate > 0);
    }

    // Mirror of the above. Highest bins collapse first, low quantiles keep the guarantee.
    @Test
    public void testCollapseHighestKeepsLowQuantiles() {
        final double[] values = datasets().get("lognormal");
        final DDSketch sketch = insertData(
                DDSketch.createBounded(relativeAccuracy, TEST_MAX_NUM_BINS, CollapsingPolicy.COLLAPSE_HIGHEST), values);
        final double[] sorted = values.clone();
        Arrays.sort(sorted);

        assertEquals(TEST_MAX_NUM_BINS, sketch.getPositiveValueStore().getNumBins());

        final long boundary = sketch.getPositiveValueStore().getMaxIndex();
        int accurate = 0;
        for (final double q : TEST_QUANTILES) {
            final double expected = exactQuantile(sorted, q);
            final double actual = sketch.getQuantileValue(q);
            if (sketch.getIndexMapping().getIndex(expected) <= boundary) {
                assertRelativeError(expected, actual, relativeAccuracy);
                accurate++;
            } else {
                assertTrue("expected " + expected + " actual " + actual, actual <= expected * FUDGE);
            }
        }
        assertRelativeError(sorted[(int) Math.floor(0.0001 * (sorted.length - 1))], sketch.getQuantileValue(0.0001), relativeAccuracy);
        assertTrue(accurate > 0);
    }
}
