package com.chaininsights.validator.config;

/** Family of authoritative client used for a configured network. */
public enum NetworkType {
    BITCOIN,
    ETHEREUM
}
