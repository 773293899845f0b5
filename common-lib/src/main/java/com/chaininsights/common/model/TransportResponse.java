package com.chaininsights.common.model;

/**
 * Result of one outbound call to a miner. Transport problems are reported through the flags,
 * never thrown; {@code output} is {@code null} whenever no usable answer arrived.
 *
 * @param <T> decoded output type
 */
public record TransportResponse<T>(
    T output,
    double processTime,
    int statusCode,
    boolean timeout,
    boolean blacklist,
    boolean failure,
    String statusMessage
) {

    public static <T> TransportResponse<T> success(T output, double processTime) {
        return new TransportResponse<>(output, processTime, 200, false, false, false, "OK");
    }

    public static <T> TransportResponse<T> timedOut(double processTime) {
        return new TransportResponse<>(null, processTime, 408, true, false, false, "Timeout");
    }

    public static <T> TransportResponse<T> blacklisted(int statusCode, String message) {
        return new TransportResponse<>(null, 0.0, statusCode, false, true, false, message);
    }

    public static <T> TransportResponse<T> failed(int statusCode, String message, double processTime) {
        return new TransportResponse<>(null, processTime, statusCode, false, false, true, message);
    }

    public boolean isSuccess() {
        return !timeout && !blacklist && !failure && statusCode >= 200 && statusCode < 300;
    }

    public boolean hasOutput() {
        return output != null;
    }
}
