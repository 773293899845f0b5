package com.chaininsights.common.model;

public enum CrossCheckOutcome {
    PASS,
    FAIL,
    /** No answer or transport failure: indistinguishable from transient network trouble. */
    INDETERMINATE
}
