package com.chaininsights.common.consensus;

/**
 * One miner's answer to a shared benchmark query. {@code value} is {@code null} when the
 * miner did not answer.
 */
public record Vote<T>(String voter, T value, double responseTime) {

    public boolean answered() {
        return value != null;
    }
}
