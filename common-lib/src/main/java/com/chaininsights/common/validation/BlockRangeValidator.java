package com.chaininsights.common.validation;

/**
 * Sanity check for a claimed block range before any ground-truth challenge is spent on it.
 *
 * <p>A range is rejected when:
 * <ul>
 *   <li>either height is not positive</li>
 *   <li>{@code start >= end}</li>
 *   <li>{@code minRangeSize} is not positive</li>
 *   <li>{@code end} is more than {@value #LOOKAHEAD_TOLERANCE} blocks past the authoritative tip</li>
 *   <li>the inclusive width {@code end + 1 - start} is below {@code minRangeSize}</li>
 * </ul>
 *
 * <p>Pure static utility: no state.
 */
public final class BlockRangeValidator {

    /** Blocks a miner may legitimately be ahead of the authoritative client. */
    public static final long LOOKAHEAD_TOLERANCE = 3;

    private BlockRangeValidator() {}

    public static boolean isValid(long start, long end, long minRangeSize, long currentHeight) {
        return rejectionReason(start, end, minRangeSize, currentHeight) == null;
    }

    /**
     * @return a human-readable reason, or {@code null} when the range is acceptable
     */
    public static String rejectionReason(long start, long end, long minRangeSize, long currentHeight) {
        if (start <= 0 || end <= 0)                 return "non-positive block height";
        if (start >= end)                           return "start height is not below end height";
        if (minRangeSize <= 0)                      return "minimum range size is not positive";
        if (end > currentHeight + LOOKAHEAD_TOLERANCE) return "end height is ahead of the chain tip";
        if (end + 1 - start < minRangeSize)         return "range narrower than minimum sample width";
        return null;
    }
}
