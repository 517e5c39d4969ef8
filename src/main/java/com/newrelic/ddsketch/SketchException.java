// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the DDSketch project.

package com.newrelic.ddsketch;

// Thrown on any precondition violation of the public sketch API. The failing call leaves
// the sketch (and any other argument) unmodified, so the caller may catch and carry on.
public class SketchException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum ErrorKind {
        INVALID_ACCURACY,       // Relative accuracy outside (0, 1)
        INVALID_BOUND,          // Non-positive maxNumBins or missing collapsing policy
        INVALID_VALUE,          // NaN or infinite value, or negative count, passed to add()
        INVALID_QUANTILE,       // Quantile outside [0, 1]
        EMPTY_SKETCH,           // Quantile query on a sketch without observations
        INCOMPATIBLE_SKETCHES,  // Merge between sketches with different mapping or bound configuration
        COUNT_OVERFLOW          // Merge whose total count would exceed Long.MAX_VALUE
    }

    private final ErrorKind errorKind;

    public SketchException(final ErrorKind errorKind, final String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorKind + "]: " + getMessage();
    }
}
