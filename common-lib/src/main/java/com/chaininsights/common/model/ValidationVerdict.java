package com.chaininsights.common.model;

/**
 * Outcome of the structural and anti-abuse checks on a discovery response.
 * {@code statusCode} is only meaningful for {@link VerdictStatus#TRANSPORT_ERROR}.
 */
public record ValidationVerdict(VerdictStatus status, String reason, int statusCode) {

    private static final ValidationVerdict VALID = new ValidationVerdict(VerdictStatus.VALID, "ok", 200);

    public static ValidationVerdict valid() {
        return VALID;
    }

    public static ValidationVerdict invalid(String reason) {
        return new ValidationVerdict(VerdictStatus.INVALID, reason, 200);
    }

    public static ValidationVerdict transportError(int statusCode, String reason) {
        return new ValidationVerdict(VerdictStatus.TRANSPORT_ERROR, reason, statusCode);
    }

    public boolean isValid() {
        return status == VerdictStatus.VALID;
    }
}
