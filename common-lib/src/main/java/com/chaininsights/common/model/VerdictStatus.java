package com.chaininsights.common.model;

public enum VerdictStatus {
    VALID,
    INVALID,
    TRANSPORT_ERROR
}
